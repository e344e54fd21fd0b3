package com.example.poscore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Application settings for sales, catalog caching and the store's time zone.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /** Zone used to split ledger movements into calendar days. */
    private String zone = "America/Bogota";
    private boolean seedDemoData = false;
    private final Sales sales = new Sales();
    private final Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public boolean isSeedDemoData() {
        return seedDemoData;
    }

    public void setSeedDemoData(boolean seedDemoData) {
        this.seedDemoData = seedDemoData;
    }

    public Sales getSales() {
        return sales;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public static class Sales {
        /** Tax rate applied when the checkout request carries none (0.19 = 19%). */
        private BigDecimal defaultTaxRate = new BigDecimal("0.19");

        public BigDecimal getDefaultTaxRate() {
            return defaultTaxRate;
        }

        public void setDefaultTaxRate(BigDecimal defaultTaxRate) {
            this.defaultTaxRate = defaultTaxRate;
        }
    }

    public static class Catalog {
        private Duration productCacheTtl = Duration.ofSeconds(30);
        private Duration promotionCacheTtl = Duration.ofSeconds(30);

        public Duration getProductCacheTtl() {
            return productCacheTtl;
        }

        public void setProductCacheTtl(Duration productCacheTtl) {
            this.productCacheTtl = productCacheTtl;
        }

        public Duration getPromotionCacheTtl() {
            return promotionCacheTtl;
        }

        public void setPromotionCacheTtl(Duration promotionCacheTtl) {
            this.promotionCacheTtl = promotionCacheTtl;
        }
    }
}
