package com.example.poscore.common;

import com.example.poscore.cart.InsufficientStockException;
import com.example.poscore.promotion.PromotionExhaustedException;
import com.example.poscore.sale.CommitStep;
import com.example.poscore.sale.SaleCommitException;
import com.example.poscore.sale.StockConflictException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to JSON error bodies: {@code {"error": message}}
 * plus {@code step} for commit failures and {@code errors} for validation.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String KEY_ERROR = "error";
    private static final String KEY_STEP = "step";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = body(ex.getMessage());
        body.put("errors", ex.getErrors());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(ex.getMessage()));
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException ex) {
        Map<String, Object> body = body(ex.getMessage());
        body.put("product_id", ex.getProductId());
        body.put("requested", ex.getRequested());
        body.put("available", ex.getAvailable());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(StockConflictException.class)
    public ResponseEntity<Map<String, Object>> handleStockConflict(StockConflictException ex) {
        Map<String, Object> body = body(ex.getMessage());
        body.put(KEY_STEP, ex.getStep().name());
        body.put("product_id", ex.getProductId());
        body.put("requested", ex.getRequested());
        body.put("available", ex.getAvailable());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(PromotionExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handlePromotionExhausted(PromotionExhaustedException ex) {
        Map<String, Object> body = body(ex.getMessage());
        body.put(KEY_STEP, CommitStep.CLAIM_PROMOTION.name());
        body.put("promotion_id", ex.getPromotionId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(SaleCommitException.class)
    public ResponseEntity<Map<String, Object>> handleCommitFailure(SaleCommitException ex) {
        Map<String, Object> body = body("Failed to commit sale");
        body.put(KEY_STEP, ex.getStep().name());
        body.put("details", ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        return ResponseEntity.badRequest().body(body("Malformed request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse er) {
            // framework errors (unknown route, wrong method) keep their own status
            return ResponseEntity.status(er.getStatusCode()).body(body(ex.getMessage()));
        }
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("Internal server error"));
    }

    private static Map<String, Object> body(String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_ERROR, message);
        return m;
    }
}
