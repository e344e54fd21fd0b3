package com.example.poscore.cart;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * One product in a cart. The unit price is a snapshot taken when the product
 * was added, so later catalog price edits do not reach an open cart.
 */
@Getter
public final class CartLine {
    private final Long productId;
    private final String productName;
    private final Long categoryId;
    private final int quantity;
    private final BigDecimal unitPrice;

    public CartLine(Long productId, String productName, Long categoryId, int quantity, BigDecimal unitPrice) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        this.productId = productId;
        this.productName = productName;
        this.categoryId = categoryId;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
    }

    public BigDecimal getLineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    CartLine withQuantity(int newQuantity) {
        return new CartLine(productId, productName, categoryId, newQuantity, unitPrice);
    }

    @Override
    public String toString() {
        return "CartLine{productId=" + productId + ", quantity=" + quantity + ", unitPrice=" + unitPrice + "}";
    }
}
