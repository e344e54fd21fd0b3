package com.example.poscore.sale;

import com.example.poscore.cart.CartLine;
import com.example.poscore.client.ClientRepository;
import com.example.poscore.common.PosException;
import com.example.poscore.common.ValidationException;
import com.example.poscore.ledger.Ledger;
import com.example.poscore.ledger.LedgerEntryKind;
import com.example.poscore.product.ProductCatalog;
import com.example.poscore.promotion.PromotionCatalog;
import com.example.poscore.promotion.PromotionExhaustedException;
import com.example.poscore.promotion.PromotionResult;
import com.example.poscore.utils.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Commits a priced cart as a sale.
 * <p>
 * All writes (sale header and lines, stock decrements, promotion usage, the
 * ledger entry) happen in one database transaction, so a failure at any step
 * leaves no trace of the sale except a {@code failed} header written
 * afterwards in a transaction of its own.
 */
@Service
public class SaleFinalizer {

    private static final Logger log = LoggerFactory.getLogger(SaleFinalizer.class);
    private static final int MAX_REASON_LENGTH = 500;
    private static final int MAX_TAX_RATE_SCALE = 4;

    private final ProductCatalog productCatalog;
    private final PromotionCatalog promotionCatalog;
    private final Ledger ledger;
    private final SaleRepository saleRepository;
    private final ClientRepository clientRepository;
    private final Clock clock;
    private final TransactionTemplate commitTx;
    private final TransactionTemplate failureTx;

    public SaleFinalizer(ProductCatalog productCatalog, PromotionCatalog promotionCatalog, Ledger ledger,
            SaleRepository saleRepository, ClientRepository clientRepository,
            PlatformTransactionManager transactionManager, Clock clock) {
        this.productCatalog = productCatalog;
        this.promotionCatalog = promotionCatalog;
        this.ledger = ledger;
        this.saleRepository = saleRepository;
        this.clientRepository = clientRepository;
        this.clock = clock;
        this.commitTx = new TransactionTemplate(transactionManager);
        this.failureTx = new TransactionTemplate(transactionManager);
        this.failureTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public Sale commit(CommitRequest req) {
        validate(req);

        Progress progress = new Progress();
        progress.moveTo(SaleStatus.COMMITTING);
        try {
            Sale sale = commitTx.execute(status -> runSteps(req, progress));
            progress.moveTo(SaleStatus.COMPLETED);
            log.info("SALE committed id={} total={} discount={} promotion={} lines={}", sale.getId(),
                    sale.getTotal(), sale.getDiscount(), sale.getPromotionId(), sale.getLines().size());
            return sale;
        } catch (ValidationException e) {
            // nothing was persisted; no failed sale is recorded for invalid input
            log.warn("SALE commit invalid at {}: {}", progress.step, e.getMessage());
            progress.moveTo(SaleStatus.FAILED);
            throw e;
        } catch (PosException e) {
            log.warn("SALE commit rejected at {}: {}", progress.step, e.getMessage());
            progress.moveTo(SaleStatus.FAILED);
            recordFailure(req, progress.step, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("SALE commit failed at {}", progress.step, e);
            progress.moveTo(SaleStatus.FAILED);
            SaleCommitException failure = new SaleCommitException(progress.step, e);
            recordFailure(req, progress.step, failure);
            throw failure;
        } finally {
            productCatalog.evictAll();
            promotionCatalog.evictCache();
        }
    }

    private void validate(CommitRequest req) {
        if (req.getLines() == null || req.getLines().isEmpty()) {
            throw new ValidationException("Cart is empty");
        }
        checkTaxRate(req.getTaxRate());
        if (req.getPaymentMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
        if (req.getCustomerId() != null && !clientRepository.existsById(req.getCustomerId())) {
            throw new ValidationException("Unknown customer: " + req.getCustomerId());
        }
    }

    private Sale runSteps(CommitRequest req, Progress progress) {
        List<CartLine> lines = req.getLines();

        progress.step = CommitStep.REVALIDATE_STOCK;
        for (CartLine line : lines) {
            int stock = productCatalog.currentStock(line.getProductId());
            if (stock < line.getQuantity()) {
                throw new StockConflictException(progress.step, line.getProductId(), line.getQuantity(), stock);
            }
        }

        progress.step = CommitStep.CLAIM_PROMOTION;
        PromotionResult promotion = claimPromotion(req);

        progress.step = CommitStep.COMPUTE_TOTALS;
        BigDecimal subtotal = subtotalOf(lines);
        BigDecimal discount = promotion == null ? MoneyUtils.zero()
                : MoneyUtils.min(MoneyUtils.money(promotion.getDiscountAmount()), subtotal);
        BigDecimal taxable = subtotal.subtract(discount);
        BigDecimal tax = MoneyUtils.money(taxable.multiply(req.getTaxRate()));
        BigDecimal total = MoneyUtils.money(taxable.add(tax));
        if (total.signum() <= 0) {
            throw new ValidationException("Invalid total: " + total);
        }

        progress.step = CommitStep.PERSIST_SALE;
        Sale sale = Sale.builder()
                .clientId(req.getCustomerId())
                .operatorId(req.getOperatorId())
                .subtotal(subtotal)
                .discount(discount)
                .tax(tax)
                .total(total)
                .taxRate(req.getTaxRate())
                .paymentMethod(req.getPaymentMethod())
                .status(SaleStatus.COMPLETED)
                .promotionId(promotion == null ? null : promotion.getPromotionId())
                .promotionDescription(promotion == null ? null : promotion.getDescription())
                .createdAt(OffsetDateTime.now(clock))
                .build();
        for (CartLine line : lines) {
            sale.addLine(SaleLine.builder()
                    .productId(line.getProductId())
                    .productName(line.getProductName())
                    .quantity(line.getQuantity())
                    .unitPrice(MoneyUtils.money(line.getUnitPrice()))
                    .lineTotal(MoneyUtils.money(line.getLineTotal()))
                    .build());
        }
        sale = saleRepository.saveAndFlush(sale);

        progress.step = CommitStep.DECREMENT_STOCK;
        // fixed product order so two sales sharing products lock rows in the same order
        List<CartLine> byProduct = lines.stream().sorted(Comparator.comparing(CartLine::getProductId)).toList();
        for (CartLine line : byProduct) {
            if (!productCatalog.decrementStock(line.getProductId(), line.getQuantity())) {
                int stock = productCatalog.currentStock(line.getProductId());
                throw new StockConflictException(progress.step, line.getProductId(), line.getQuantity(), stock);
            }
        }

        progress.step = CommitStep.RECORD_PROMOTION_USAGE;
        if (promotion != null) {
            promotionCatalog.recordUsage(promotion.getPromotionId(), sale.getId(), discount);
        }

        progress.step = CommitStep.APPEND_LEDGER;
        ledger.append(LedgerEntryKind.SALE, total, "Sale #" + sale.getId(), sale.getId(), req.getOperatorId());

        return sale;
    }

    /**
     * Takes one use of the requested promotion. Returns null when there is no
     * promotion or it ran out and the request tolerates losing the discount.
     */
    private PromotionResult claimPromotion(CommitRequest req) {
        PromotionResult promotion = req.getPromotion();
        if (promotion == null || !promotion.isApplicable()) {
            return null;
        }
        if (promotionCatalog.claimUsage(promotion.getPromotionId())) {
            return promotion;
        }
        if (req.isRequirePromotion()) {
            throw new PromotionExhaustedException(promotion.getPromotionId());
        }
        log.warn("Promotion {} no longer available at commit; sale continues without discount {}",
                promotion.getPromotionId(), promotion.getDiscountAmount());
        return null;
    }

    private void recordFailure(CommitRequest req, CommitStep step, RuntimeException cause) {
        try {
            failureTx.executeWithoutResult(status -> saleRepository.save(Sale.builder()
                    .clientId(req.getCustomerId())
                    .operatorId(req.getOperatorId())
                    .subtotal(subtotalOf(req.getLines()))
                    .discount(MoneyUtils.zero())
                    .tax(MoneyUtils.zero())
                    .total(MoneyUtils.zero())
                    .taxRate(req.getTaxRate())
                    .paymentMethod(req.getPaymentMethod())
                    .status(SaleStatus.FAILED)
                    .failureStep(step.name())
                    .failureReason(truncate(cause.getMessage()))
                    .createdAt(OffsetDateTime.now(clock))
                    .build()));
        } catch (RuntimeException e) {
            log.error("Could not record failed sale (step={})", step, e);
            cause.addSuppressed(e);
        }
    }

    /** A tax rate is a fraction in [0, 1] with at most four decimals, as stored on the sale. */
    static void checkTaxRate(BigDecimal rate) {
        if (rate == null) {
            throw new ValidationException("Tax rate is required");
        }
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("Tax rate must be between 0 and 1");
        }
        if (rate.stripTrailingZeros().scale() > MAX_TAX_RATE_SCALE) {
            throw new ValidationException("Tax rate allows at most " + MAX_TAX_RATE_SCALE + " decimals");
        }
    }

    private static BigDecimal subtotalOf(List<CartLine> lines) {
        BigDecimal sum = BigDecimal.ZERO;
        for (CartLine line : lines) {
            sum = sum.add(line.getLineTotal());
        }
        return MoneyUtils.money(sum);
    }

    private static String truncate(String s) {
        if (s == null)
            return null;
        return s.length() <= MAX_REASON_LENGTH ? s : s.substring(0, MAX_REASON_LENGTH);
    }

    /** Current state and step of one commit. */
    private static final class Progress {
        private SaleStatus status = SaleStatus.PRICING;
        private CommitStep step = CommitStep.VALIDATE;

        void moveTo(SaleStatus next) {
            if (!status.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal sale transition " + status + " -> " + next);
            }
            status = next;
        }
    }
}
