package com.example.poscore.product;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "product")
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true)
    private String sku;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, precision = 12, scale = 2)
    @lombok.Builder.Default
    private BigDecimal cost = BigDecimal.ZERO;

    @Column(name = "category_id")
    @JsonProperty("category_id")
    private Long categoryId;

    // only changed through ProductRepository.decrementStockIfAvailable during a sale
    @Column(name = "stock_quantity", nullable = false)
    @lombok.Builder.Default
    @JsonProperty("stock_quantity")
    private Integer stockQuantity = 0;

    @Column(name = "min_stock", nullable = false)
    @lombok.Builder.Default
    @JsonProperty("min_stock")
    private Integer minStock = 0;

    @Column(name = "max_stock", nullable = false)
    @lombok.Builder.Default
    @JsonProperty("max_stock")
    private Integer maxStock = 100;

    @Column(nullable = false)
    @lombok.Builder.Default
    private Boolean active = Boolean.TRUE;
}
