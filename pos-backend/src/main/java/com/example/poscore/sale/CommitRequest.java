package com.example.poscore.sale;

import com.example.poscore.cart.CartLine;
import com.example.poscore.promotion.PromotionResult;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything the finalizer needs to turn a priced cart into a sale.
 * {@code promotion} is the evaluator's winner, or null when none applied.
 */
@Getter
@Builder
public class CommitRequest {
    private final List<CartLine> lines;
    private final PromotionResult promotion;
    private final BigDecimal taxRate;
    private final PaymentMethod paymentMethod;
    private final Long customerId;
    private final Long operatorId;
    /** Fail instead of dropping the discount when the promotion runs out mid-commit. */
    private final boolean requirePromotion;
}
