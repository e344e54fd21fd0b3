package com.example.poscore.sale;

import com.example.poscore.cart.CartModel;
import com.example.poscore.common.ValidationException;
import com.example.poscore.ledger.Ledger;
import com.example.poscore.ledger.LedgerEntry;
import com.example.poscore.ledger.LedgerEntryKind;
import com.example.poscore.ledger.LedgerEntryRepository;
import com.example.poscore.product.Product;
import com.example.poscore.product.ProductCatalog;
import com.example.poscore.product.ProductRepository;
import com.example.poscore.promotion.Promotion;
import com.example.poscore.promotion.PromotionCatalog;
import com.example.poscore.promotion.PromotionEvaluator;
import com.example.poscore.promotion.PromotionExhaustedException;
import com.example.poscore.promotion.PromotionKind;
import com.example.poscore.promotion.PromotionRepository;
import com.example.poscore.promotion.PromotionResult;
import com.example.poscore.promotion.PromotionUsageRepository;
import com.example.poscore.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class SaleFinalizerIntegrationTest {

    private static final BigDecimal TAX_19 = new BigDecimal("0.19");

    @Autowired
    private TestFixtures fixtures;
    @Autowired
    private CheckoutService checkoutService;
    @Autowired
    private SaleFinalizer saleFinalizer;
    @Autowired
    private ProductCatalog productCatalog;
    @Autowired
    private PromotionCatalog promotionCatalog;
    @Autowired
    private PromotionEvaluator promotionEvaluator;
    @Autowired
    private SaleRepository saleRepository;
    @Autowired
    private ProductRepository productRepository;
    @Autowired
    private PromotionRepository promotionRepository;
    @Autowired
    private PromotionUsageRepository promotionUsageRepository;
    @Autowired
    private LedgerEntryRepository ledgerEntryRepository;
    @Autowired
    private Ledger ledger;

    @BeforeEach
    void reset() {
        fixtures.reset();
    }

    private CheckoutRequest request(Long productId, int qty) {
        return CheckoutRequest.builder()
                .items(List.of(new CheckoutRequest.Item(productId, qty)))
                .paymentMethod("cash")
                .taxRate(TAX_19)
                .build();
    }

    private CommitRequest.CommitRequestBuilder commitOf(CartModel cart, PromotionResult promotion) {
        return CommitRequest.builder()
                .lines(cart.lines())
                .promotion(promotion)
                .taxRate(TAX_19)
                .paymentMethod(PaymentMethod.CASH);
    }

    @Test
    void percentagePromotionSaleCommitsEveryEffect() {
        Product p = fixtures.product("Headphones", "100.00", 10);
        Promotion tenPercent = fixtures.promotion(PromotionKind.PERCENTAGE, "10");
        Long cashierId = fixtures.user("cashier").getId();

        Sale sale = checkoutService.checkout(request(p.getId(), 3), cashierId);

        assertThat(sale.getStatus()).isEqualTo(SaleStatus.COMPLETED);
        assertThat(sale.getSubtotal()).isEqualByComparingTo("300.00");
        assertThat(sale.getDiscount()).isEqualByComparingTo("30.00");
        assertThat(sale.getTax()).isEqualByComparingTo("51.30");
        assertThat(sale.getTotal()).isEqualByComparingTo("321.30");
        assertThat(sale.getPromotionId()).isEqualTo(tenPercent.getId());
        assertThat(sale.getOperatorId()).isEqualTo(cashierId);

        assertThat(fixtures.stockOf(p.getId())).isEqualTo(7);
        assertThat(fixtures.usesOf(tenPercent.getId())).isEqualTo(1);
        assertThat(promotionUsageRepository.findBySaleId(sale.getId()))
                .singleElement()
                .satisfies(u -> assertThat(u.getDiscountAmount()).isEqualByComparingTo("30.00"));

        List<LedgerEntry> entries = ledger.findBySaleReference(sale.getId());
        assertThat(entries).singleElement().satisfies(e -> {
            assertThat(e.getKind()).isEqualTo(LedgerEntryKind.SALE);
            assertThat(e.getAmount()).isEqualByComparingTo(sale.getTotal());
        });

        Sale receipt = checkoutService.getReceipt(sale.getId());
        assertThat(receipt.getLines()).singleElement().satisfies(l -> {
            assertThat(l.getQuantity()).isEqualTo(3);
            assertThat(l.getLineTotal()).isEqualByComparingTo("300.00");
        });
    }

    @Test
    void buyTwoGetOneDiscountsOneUnit() {
        Product p = fixtures.product("Soda", "100.00", 10);
        fixtures.promotion(PromotionKind.BUY_X_GET_Y, "1",
                b -> b.buyQuantity(2).getQuantity(1).productIds(new HashSet<>(Set.of(p.getId()))));

        Sale sale = checkoutService.checkout(request(p.getId(), 3).toBuilder().taxRate(BigDecimal.ZERO).build(),
                null);

        assertThat(sale.getDiscount()).isEqualByComparingTo("100.00");
        assertThat(sale.getTotal()).isEqualByComparingTo("200.00");
    }

    @Test
    void staleCartFailsRevalidationAndLeavesNoTrace() {
        Product p = fixtures.product("Cheese", "8.00", 5);
        CartModel cart = new CartModel();
        cart.addLine(productCatalog.getRequired(p.getId()), 4);

        // another till sells 2 units after this cart was priced
        productRepository.decrementStockIfAvailable(p.getId(), 2);

        assertThatThrownBy(() -> saleFinalizer.commit(commitOf(cart, null).build()))
                .isInstanceOfSatisfying(StockConflictException.class, e -> {
                    assertThat(e.getStep()).isEqualTo(CommitStep.REVALIDATE_STOCK);
                    assertThat(e.getAvailable()).isEqualTo(3);
                });

        assertThat(fixtures.stockOf(p.getId())).isEqualTo(3);
        assertThat(saleRepository.countByStatus(SaleStatus.COMPLETED)).isZero();
        assertThat(ledgerEntryRepository.count()).isZero();
        assertThat(saleRepository.findByStatusOrderByIdAsc(SaleStatus.FAILED)).singleElement().satisfies(s -> {
            assertThat(s.getFailureStep()).isEqualTo("REVALIDATE_STOCK");
            assertThat(s.getTotal()).isEqualByComparingTo("0.00");
        });
    }

    @Test
    void exhaustedPromotionIsDroppedUnlessRequired() {
        Product p = fixtures.product("Tea", "10.00", 10);
        Promotion once = fixtures.promotion(PromotionKind.FIXED_AMOUNT, "2", b -> b.maxUses(1));
        CartModel cart = new CartModel();
        cart.addLine(productCatalog.getRequired(p.getId()), 1);
        PromotionResult priced = promotionEvaluator
                .evaluate(List.of(once), cart.lines(), cart.subtotal())
                .orElseThrow();

        // used up by someone else between pricing and commit
        promotionRepository.claimUsage(once.getId(), OffsetDateTime.now());

        assertThatThrownBy(() -> saleFinalizer.commit(commitOf(cart, priced).requirePromotion(true).build()))
                .isInstanceOf(PromotionExhaustedException.class);
        assertThat(fixtures.stockOf(p.getId())).isEqualTo(10);

        Sale sale = saleFinalizer.commit(commitOf(cart, priced).build());
        assertThat(sale.getDiscount()).isEqualByComparingTo("0.00");
        assertThat(sale.getPromotionId()).isNull();
        assertThat(sale.getTotal()).isEqualByComparingTo("11.90");
        assertThat(fixtures.usesOf(once.getId())).isEqualTo(1);
        assertThat(promotionUsageRepository.countByPromotionId(once.getId())).isZero();
    }

    @Test
    void taxRateKeepsItsStoredScale() {
        Product p = fixtures.product("Candle", "10.00", 10);

        Sale sale = checkoutService.checkout(
                request(p.getId(), 1).toBuilder().taxRate(new BigDecimal("0.0825")).build(), null);

        assertThat(saleRepository.findById(sale.getId()).orElseThrow().getTaxRate())
                .isEqualByComparingTo("0.0825");
        assertThat(sale.getTax()).isEqualByComparingTo("0.83");
    }

    @Test
    void promotionDeactivatedOrExpiredAfterPricingIsNotClaimed() {
        Product p = fixtures.product("Jam", "20.00", 10);
        Promotion promo = fixtures.promotion(PromotionKind.FIXED_AMOUNT, "5");
        CartModel cart = new CartModel();
        cart.addLine(productCatalog.getRequired(p.getId()), 1);
        PromotionResult priced = promotionEvaluator
                .evaluate(List.of(promo), cart.lines(), cart.subtotal())
                .orElseThrow();

        promotionCatalog.setActive(promo.getId(), false);

        assertThatThrownBy(() -> saleFinalizer.commit(commitOf(cart, priced).requirePromotion(true).build()))
                .isInstanceOf(PromotionExhaustedException.class);
        Sale withoutDiscount = saleFinalizer.commit(commitOf(cart, priced).build());
        assertThat(withoutDiscount.getPromotionId()).isNull();
        assertThat(withoutDiscount.getDiscount()).isEqualByComparingTo("0.00");

        Promotion expired = promotionRepository.findById(promo.getId()).orElseThrow();
        expired.setActive(true);
        expired.setEndDate(OffsetDateTime.now().minusMinutes(1));
        promotionRepository.save(expired);

        Sale afterExpiry = saleFinalizer.commit(commitOf(cart, priced).build());
        assertThat(afterExpiry.getPromotionId()).isNull();
        assertThat(fixtures.usesOf(promo.getId())).isZero();
        assertThat(promotionUsageRepository.countByPromotionId(promo.getId())).isZero();
    }

    @Test
    void nonPositiveTotalIsRejectedAtComputeTotals() {
        Product p = fixtures.product("Sample", "5.00", 10);
        Promotion free = fixtures.promotion(PromotionKind.PERCENTAGE, "100");
        Long cashierId = fixtures.user("cashier").getId();

        assertThatThrownBy(() -> checkoutService.checkout(request(p.getId(), 1), cashierId))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid total");

        assertThat(fixtures.stockOf(p.getId())).isEqualTo(10);
        assertThat(fixtures.usesOf(free.getId())).isZero();
        assertThat(saleRepository.count()).isZero();
        assertThat(ledgerEntryRepository.count()).isZero();
    }

    @Test
    void requestValidationHappensBeforeAnyWrite() {
        Product p = fixtures.product("Water", "1.00", 10);

        assertThatThrownBy(() -> checkoutService.checkout(
                request(p.getId(), 1).toBuilder().paymentMethod("crypto").build(), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> checkoutService.checkout(
                request(p.getId(), 1).toBuilder().customerId(-1L).build(), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown customer");
        assertThatThrownBy(() -> checkoutService.checkout(
                request(p.getId(), 1).toBuilder().taxRate(new BigDecimal("-0.01")).build(), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> saleFinalizer.commit(CommitRequest.builder()
                .lines(List.of()).taxRate(TAX_19).paymentMethod(PaymentMethod.CARD).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> checkoutService.checkout(
                request(p.getId(), 1).toBuilder().taxRate(new BigDecimal("0.12345")).build(), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("decimals");
        assertThatThrownBy(() -> checkoutService.checkout(
                request(p.getId(), 1).toBuilder().taxRate(new BigDecimal("100")).build(), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> checkoutService.preview(
                request(p.getId(), 1).toBuilder().taxRate(new BigDecimal("1.5")).build()))
                .isInstanceOf(ValidationException.class);

        assertThat(saleRepository.count()).isZero();
    }

    @Test
    void knownCustomerIsLinkedToTheSale() {
        Product p = fixtures.product("Bread", "4.00", 10);
        Long clientId = fixtures.client("Ana").getId();

        Sale sale = checkoutService.checkout(request(p.getId(), 2).toBuilder()
                .customerId(clientId).paymentMethod("transfer").build(), null);

        assertThat(sale.getClientId()).isEqualTo(clientId);
        assertThat(sale.getPaymentMethod()).isEqualTo(PaymentMethod.TRANSFER);
    }
}
