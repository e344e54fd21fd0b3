package com.example.poscore.sale;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Cart as sent by the till: product ids and quantities, prices come from the catalog. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {
    @JsonProperty("items")
    @lombok.Builder.Default
    private List<Item> items = new ArrayList<>();
    @JsonProperty("payment_method")
    private String paymentMethod;
    // null means app.sales.default-tax-rate
    @JsonProperty("tax_rate")
    private BigDecimal taxRate;
    @JsonProperty("customer_id")
    private Long customerId;
    @JsonProperty("require_promotion")
    private Boolean requirePromotion;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        @JsonProperty("product_id")
        private Long productId;
        @JsonProperty("quantity")
        private Integer quantity;
    }
}
