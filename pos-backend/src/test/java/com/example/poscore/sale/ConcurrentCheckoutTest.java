package com.example.poscore.sale;

import com.example.poscore.product.Product;
import com.example.poscore.promotion.Promotion;
import com.example.poscore.promotion.PromotionExhaustedException;
import com.example.poscore.promotion.PromotionKind;
import com.example.poscore.promotion.PromotionUsageRepository;
import com.example.poscore.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ConcurrentCheckoutTest {

    @Autowired
    private TestFixtures fixtures;
    @Autowired
    private CheckoutService checkoutService;
    @Autowired
    private SaleRepository saleRepository;
    @Autowired
    private PromotionUsageRepository promotionUsageRepository;

    @BeforeEach
    void reset() {
        fixtures.reset();
    }

    private static CheckoutRequest buy(Long productId, boolean requirePromotion) {
        return CheckoutRequest.builder()
                .items(List.of(new CheckoutRequest.Item(productId, 1)))
                .paymentMethod("cash")
                .taxRate(BigDecimal.ZERO)
                .requirePromotion(requirePromotion)
                .build();
    }

    /** Runs every request at once; each outcome is either a Sale or the exception it threw. */
    private List<Object> runTogether(List<CheckoutRequest> requests) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(requests.size());
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(requests.size());
        List<Object> outcomes = new CopyOnWriteArrayList<>();
        for (CheckoutRequest req : requests) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    outcomes.add(checkoutService.checkout(req, null));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    outcomes.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertThat(doneLatch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        return outcomes;
    }

    private static List<Sale> sales(List<Object> outcomes) {
        List<Sale> sales = new ArrayList<>();
        outcomes.stream().filter(Sale.class::isInstance).map(Sale.class::cast).forEach(sales::add);
        return sales;
    }

    @Test
    @DisplayName("two tills selling the last unit: one sale, one stock conflict")
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void lastUnitIsSoldOnce() throws InterruptedException {
        Product p = fixtures.product("Last jacket", "80.00", 1);

        List<Object> outcomes = runTogether(List.of(buy(p.getId(), false), buy(p.getId(), false)));

        assertThat(outcomes).hasSize(2);
        assertThat(sales(outcomes)).hasSize(1);
        assertThat(outcomes).filteredOn(StockConflictException.class::isInstance).hasSize(1);
        assertThat(fixtures.stockOf(p.getId())).isZero();
        assertThat(saleRepository.countByStatus(SaleStatus.COMPLETED)).isEqualTo(1);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void stockNeverGoesNegativeUnderLoad() throws InterruptedException {
        Product p = fixtures.product("Concert ticket", "50.00", 3);
        List<CheckoutRequest> requests = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            requests.add(buy(p.getId(), false));
        }

        List<Object> outcomes = runTogether(requests);

        assertThat(sales(outcomes)).hasSize(3);
        assertThat(outcomes).filteredOn(StockConflictException.class::isInstance).hasSize(7);
        assertThat(fixtures.stockOf(p.getId())).isZero();
    }

    @Test
    @DisplayName("single-use promotion raced by two sales: only one gets the discount")
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void singleUsePromotionIsAppliedOnce() throws InterruptedException {
        Product a = fixtures.product("Lamp", "40.00", 10);
        Product b = fixtures.product("Rug", "60.00", 10);
        Promotion once = fixtures.promotion(PromotionKind.FIXED_AMOUNT, "10", p -> p.maxUses(1));

        List<Object> outcomes = runTogether(List.of(buy(a.getId(), false), buy(b.getId(), false)));

        List<Sale> sales = sales(outcomes);
        assertThat(sales).hasSize(2);
        assertThat(sales).filteredOn(s -> once.getId().equals(s.getPromotionId())).hasSize(1);
        assertThat(sales).filteredOn(s -> s.getPromotionId() == null)
                .singleElement()
                .satisfies(s -> assertThat(s.getDiscount()).isEqualByComparingTo("0.00"));
        assertThat(fixtures.usesOf(once.getId())).isEqualTo(1);
        assertThat(promotionUsageRepository.countByPromotionId(once.getId())).isEqualTo(1);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void requiredSingleUsePromotionRejectsTheLoser() throws InterruptedException {
        Product a = fixtures.product("Lamp", "40.00", 10);
        Product b = fixtures.product("Rug", "60.00", 10);
        Promotion once = fixtures.promotion(PromotionKind.FIXED_AMOUNT, "10", p -> p.maxUses(1));

        List<Object> outcomes = runTogether(List.of(buy(a.getId(), true), buy(b.getId(), true)));

        assertThat(sales(outcomes)).singleElement()
                .satisfies(s -> assertThat(s.getPromotionId()).isEqualTo(once.getId()));
        assertThat(outcomes).filteredOn(PromotionExhaustedException.class::isInstance).hasSize(1);
        assertThat(fixtures.usesOf(once.getId())).isEqualTo(1);
        assertThat(fixtures.stockOf(a.getId()) + fixtures.stockOf(b.getId())).isEqualTo(19);
    }
}
