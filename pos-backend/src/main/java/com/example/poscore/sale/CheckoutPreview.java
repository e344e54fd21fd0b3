package com.example.poscore.sale;

import com.example.poscore.cart.CartLine;
import com.example.poscore.promotion.PromotionResult;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/** Priced cart before commit. Nothing is reserved; stock is checked again on commit. */
@Getter
@Builder
public class CheckoutPreview {
    private final List<CartLine> lines;
    private final BigDecimal subtotal;
    private final PromotionResult promotion;
    private final List<PromotionResult> applicablePromotions;
    private final BigDecimal discount;
    private final BigDecimal taxRate;
    private final BigDecimal tax;
    private final BigDecimal total;
}
