package com.example.poscore.sale;

import com.example.poscore.cart.CartLine;
import com.example.poscore.promotion.PromotionResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;

    private static final Logger log = LoggerFactory.getLogger(CheckoutController.class);

    @PostMapping("/preview")
    public Map<String, Object> preview(@RequestBody CheckoutRequest req) {
        CheckoutPreview preview = checkoutService.preview(req);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("items", preview.getLines().stream().map(CheckoutController::lineBody).toList());
        resp.put("subtotal", preview.getSubtotal());
        resp.put("promotion", preview.getPromotion() == null ? null : promotionBody(preview.getPromotion()));
        resp.put("applicable_promotions",
                preview.getApplicablePromotions().stream().map(CheckoutController::promotionBody).toList());
        resp.put("discount", preview.getDiscount());
        resp.put("tax_rate", preview.getTaxRate());
        resp.put("tax", preview.getTax());
        resp.put("total", preview.getTotal());
        return resp;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestAttribute(name = "userId", required = false) Long userId,
            @RequestBody CheckoutRequest req) {
        log.info("CHECKOUT request items={} payment={} operator={}",
                req.getItems() == null ? 0 : req.getItems().size(), req.getPaymentMethod(), userId);
        Sale sale = checkoutService.checkout(req, userId);
        return ResponseEntity.status(201).body(buildResponse(sale));
    }

    @GetMapping
    public List<Map<String, Object>> listRecent(@RequestParam(defaultValue = "50") int limit) {
        return checkoutService.recent(limit).stream().map(CheckoutController::buildResponse).toList();
    }

    @GetMapping("/{id}")
    public Map<String, Object> getById(@PathVariable Long id) {
        return buildResponse(checkoutService.getReceipt(id));
    }

    static Map<String, Object> buildResponse(Sale sale) {
        var lines = sale.getLines().stream().map(l -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("product_id", l.getProductId());
            m.put("product_name", l.getProductName());
            m.put("quantity", l.getQuantity());
            m.put("unit_price", l.getUnitPrice());
            m.put("line_total", l.getLineTotal());
            return m;
        }).toList();

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("id", sale.getId());
        resp.put("status", sale.getStatus().getCode());
        resp.put("created_at", sale.getCreatedAt());
        resp.put("subtotal", sale.getSubtotal());
        resp.put("discount", sale.getDiscount());
        resp.put("tax_rate", sale.getTaxRate());
        resp.put("tax", sale.getTax());
        resp.put("total", sale.getTotal());
        resp.put("payment_method", sale.getPaymentMethod().getCode());
        resp.put("customer_id", sale.getClientId());
        resp.put("operator_id", sale.getOperatorId());
        resp.put("promotion_id", sale.getPromotionId());
        resp.put("promotion_description", sale.getPromotionDescription());
        resp.put("items", lines);
        if (sale.getStatus() == SaleStatus.FAILED) {
            resp.put("failure_step", sale.getFailureStep());
            resp.put("failure_reason", sale.getFailureReason());
        }
        return resp;
    }

    private static Map<String, Object> lineBody(CartLine l) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("product_id", l.getProductId());
        m.put("product_name", l.getProductName());
        m.put("quantity", l.getQuantity());
        m.put("unit_price", l.getUnitPrice());
        m.put("line_total", l.getLineTotal());
        return m;
    }

    private static Map<String, Object> promotionBody(PromotionResult r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("promotion_id", r.getPromotionId());
        m.put("name", r.getPromotionName());
        m.put("kind", r.getKind().getCode());
        m.put("discount", r.getDiscountAmount());
        m.put("description", r.getDescription());
        m.put("applied_product_ids", r.getAppliedLines().stream().map(CartLine::getProductId).toList());
        return m;
    }
}
