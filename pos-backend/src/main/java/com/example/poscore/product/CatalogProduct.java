package com.example.poscore.product;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Immutable read model of a product as seen by the cart and the promotion
 * evaluator. Stock may lag the database by the catalog cache TTL; the sale
 * commit rechecks it.
 */
@Getter
@Builder
public final class CatalogProduct {
    private final Long id;
    private final String name;
    private final String sku;
    private final BigDecimal price;
    private final BigDecimal cost;
    private final Long categoryId;
    private final int stockQuantity;
    private final int minStock;
    private final int maxStock;

    static CatalogProduct from(Product p) {
        return CatalogProduct.builder()
                .id(p.getId())
                .name(p.getName())
                .sku(p.getSku())
                .price(p.getPrice())
                .cost(p.getCost())
                .categoryId(p.getCategoryId())
                .stockQuantity(p.getStockQuantity() == null ? 0 : p.getStockQuantity())
                .minStock(p.getMinStock() == null ? 0 : p.getMinStock())
                .maxStock(p.getMaxStock() == null ? 0 : p.getMaxStock())
                .build();
    }

    public boolean isLowStock() {
        return stockQuantity <= minStock;
    }
}
