package com.example.poscore.promotion;

import com.example.poscore.cart.CartLine;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of pricing one promotion against a cart: the discount it grants,
 * the lines it applied to and a receipt-friendly description.
 */
@Getter
@Builder
public final class PromotionResult {
    private final Long promotionId;
    private final String promotionName;
    private final PromotionKind kind;
    private final BigDecimal discountAmount;
    @lombok.Builder.Default
    private final List<CartLine> appliedLines = List.of();
    private final String description;

    public boolean isApplicable() {
        return discountAmount != null && discountAmount.signum() > 0;
    }
}
