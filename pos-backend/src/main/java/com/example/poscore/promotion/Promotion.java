package com.example.poscore.promotion;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "promotion")
public class Promotion {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @lombok.Builder.Default
    private String description = "";

    @Convert(converter = PromotionKindConverter.class)
    @Column(nullable = false)
    private PromotionKind kind;

    // percentage points, fixed amount or bundle discount depending on kind
    @Column(name = "discount_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal value;

    @Column(name = "start_date", nullable = false)
    private OffsetDateTime startDate;

    @Column(name = "end_date", nullable = false)
    private OffsetDateTime endDate;

    @Column(nullable = false)
    @lombok.Builder.Default
    private Boolean active = Boolean.TRUE;

    @Column(name = "min_purchase_amount", nullable = false, precision = 12, scale = 2)
    @lombok.Builder.Default
    private BigDecimal minPurchaseAmount = BigDecimal.ZERO;

    // null = unlimited
    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "current_uses", nullable = false)
    @lombok.Builder.Default
    private Integer currentUses = 0;

    @Column(name = "buy_quantity")
    private Integer buyQuantity;

    @Column(name = "get_quantity")
    private Integer getQuantity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "promotion_product", joinColumns = @JoinColumn(name = "promotion_id"))
    @Column(name = "product_id", nullable = false)
    @lombok.Builder.Default
    private Set<Long> productIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "promotion_category", joinColumns = @JoinColumn(name = "promotion_id"))
    @Column(name = "category_id", nullable = false)
    @lombok.Builder.Default
    private Set<Long> categoryIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "promotion_bundle_product", joinColumns = @JoinColumn(name = "promotion_id"))
    @Column(name = "product_id", nullable = false)
    @lombok.Builder.Default
    private Set<Long> bundleProductIds = new HashSet<>();

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @JsonIgnore
    public PromotionConditions getConditions() {
        return PromotionConditions.of(kind, buyQuantity, getQuantity, bundleProductIds);
    }

    /** No product or category allow-list: every cart line is eligible. */
    @JsonIgnore
    public boolean isUnrestricted() {
        return (productIds == null || productIds.isEmpty()) && (categoryIds == null || categoryIds.isEmpty());
    }

    @JsonIgnore
    public boolean isExhausted() {
        return maxUses != null && currentUses != null && currentUses >= maxUses;
    }
}
