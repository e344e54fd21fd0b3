package com.example.poscore.promotion;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/** Administrator input for creating or editing a promotion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionRequest {
    @JsonProperty("name")
    private String name;
    @JsonProperty("description")
    private String description;
    @JsonProperty("kind")
    private String kind;
    @JsonProperty("value")
    private BigDecimal value;
    @JsonProperty("start_date")
    private OffsetDateTime startDate;
    @JsonProperty("end_date")
    private OffsetDateTime endDate;
    @JsonProperty("active")
    private Boolean active;
    @JsonProperty("min_purchase_amount")
    private BigDecimal minPurchaseAmount;
    @JsonProperty("max_uses")
    private Integer maxUses;
    @JsonProperty("product_ids")
    @lombok.Builder.Default
    private List<Long> productIds = new ArrayList<>();
    @JsonProperty("category_ids")
    @lombok.Builder.Default
    private List<Long> categoryIds = new ArrayList<>();
    @JsonProperty("buy_quantity")
    private Integer buyQuantity;
    @JsonProperty("get_quantity")
    private Integer getQuantity;
    @JsonProperty("bundle_product_ids")
    @lombok.Builder.Default
    private List<Long> bundleProductIds = new ArrayList<>();
}
