package com.example.poscore.config;

import com.example.poscore.product.Product;
import com.example.poscore.product.ProductRepository;
import com.example.poscore.promotion.Promotion;
import com.example.poscore.promotion.PromotionKind;
import com.example.poscore.promotion.PromotionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;

/**
 * Loads a small demo catalog on an empty database when
 * {@code app.seed-demo-data=true}. Users are seeded by Liquibase.
 */
@Configuration
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final AppProperties props;
    private final ProductRepository productRepository;
    private final PromotionRepository promotionRepository;
    private final Clock clock;

    public DataInitializer(AppProperties props, ProductRepository productRepository,
            PromotionRepository promotionRepository, Clock clock) {
        this.props = props;
        this.productRepository = productRepository;
        this.promotionRepository = promotionRepository;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seedDemoData() {
        if (!props.isSeedDemoData()) {
            return;
        }
        if (productRepository.count() > 0) {
            log.info("Catalog already has products; demo data skipped");
            return;
        }
        List<Product> products = productRepository.saveAll(List.of(
                product("Coffee 500g", "COF-500", "12.50", "7.80", 1L, 40),
                product("Whole milk 1L", "MLK-1L", "1.90", "1.10", 2L, 120),
                product("Sourdough bread", "BRD-SD", "4.20", "1.60", 3L, 25),
                product("Butter 200g", "BTR-200", "3.40", "2.00", 2L, 60)));

        OffsetDateTime now = OffsetDateTime.now(clock);
        promotionRepository.save(Promotion.builder()
                .name("Dairy week")
                .description("10% off dairy")
                .kind(PromotionKind.PERCENTAGE)
                .value(new BigDecimal("10"))
                .startDate(now.minusDays(1))
                .endDate(now.plusDays(30))
                .categoryIds(new HashSet<>(List.of(2L)))
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Demo data loaded: {} products, 1 promotion", products.size());
    }

    private static Product product(String name, String sku, String price, String cost, Long categoryId, int stock) {
        return Product.builder()
                .name(name)
                .sku(sku)
                .price(new BigDecimal(price))
                .cost(new BigDecimal(cost))
                .categoryId(categoryId)
                .stockQuantity(stock)
                .build();
    }
}
