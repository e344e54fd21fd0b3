package com.example.poscore.sale;

import com.example.poscore.cart.CartModel;
import com.example.poscore.common.NotFoundException;
import com.example.poscore.common.ValidationException;
import com.example.poscore.config.AppProperties;
import com.example.poscore.product.ProductCatalog;
import com.example.poscore.promotion.Promotion;
import com.example.poscore.promotion.PromotionCatalog;
import com.example.poscore.promotion.PromotionEvaluator;
import com.example.poscore.promotion.PromotionResult;
import com.example.poscore.utils.MoneyUtils;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Till-facing entry point: builds a cart from product ids, prices it with the
 * active promotions and hands it to {@link SaleFinalizer}.
 */
@Service
public class CheckoutService {

    private final ProductCatalog productCatalog;
    private final PromotionCatalog promotionCatalog;
    private final PromotionEvaluator promotionEvaluator;
    private final SaleFinalizer saleFinalizer;
    private final SaleRepository saleRepository;
    private final AppProperties props;

    public CheckoutService(ProductCatalog productCatalog, PromotionCatalog promotionCatalog,
            PromotionEvaluator promotionEvaluator, SaleFinalizer saleFinalizer, SaleRepository saleRepository,
            AppProperties props) {
        this.productCatalog = productCatalog;
        this.promotionCatalog = promotionCatalog;
        this.promotionEvaluator = promotionEvaluator;
        this.saleFinalizer = saleFinalizer;
        this.saleRepository = saleRepository;
        this.props = props;
    }

    public CartModel buildCart(List<CheckoutRequest.Item> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Cart is empty");
        }
        CartModel cart = new CartModel();
        for (CheckoutRequest.Item item : items) {
            if (item.getProductId() == null || item.getQuantity() == null) {
                throw new ValidationException("Each item needs product_id and quantity");
            }
            cart.addLine(productCatalog.getRequired(item.getProductId()), item.getQuantity());
        }
        return cart;
    }

    public CheckoutPreview preview(CheckoutRequest req) {
        CartModel cart = buildCart(req.getItems());
        BigDecimal subtotal = cart.subtotal();
        List<Promotion> active = promotionCatalog.activePromotions();
        PromotionResult best = promotionEvaluator.evaluate(active, cart.lines(), subtotal).orElse(null);
        BigDecimal taxRate = taxRateOf(req);

        BigDecimal discount = best == null ? MoneyUtils.zero() : best.getDiscountAmount();
        BigDecimal taxable = subtotal.subtract(discount);
        BigDecimal tax = MoneyUtils.money(taxable.multiply(taxRate));
        return CheckoutPreview.builder()
                .lines(cart.lines())
                .subtotal(subtotal)
                .promotion(best)
                .applicablePromotions(promotionEvaluator.applicable(active, cart.lines(), subtotal))
                .discount(discount)
                .taxRate(taxRate)
                .tax(tax)
                .total(MoneyUtils.money(taxable.add(tax)))
                .build();
    }

    public Sale checkout(CheckoutRequest req, Long operatorId) {
        PaymentMethod method = PaymentMethod.fromCode(req.getPaymentMethod());
        BigDecimal taxRate = taxRateOf(req);
        CartModel cart = buildCart(req.getItems());
        BigDecimal subtotal = cart.subtotal();
        PromotionResult best = promotionEvaluator
                .evaluate(promotionCatalog.activePromotions(), cart.lines(), subtotal)
                .orElse(null);

        return saleFinalizer.commit(CommitRequest.builder()
                .lines(cart.lines())
                .promotion(best)
                .taxRate(taxRate)
                .paymentMethod(method)
                .customerId(req.getCustomerId())
                .operatorId(operatorId)
                .requirePromotion(Boolean.TRUE.equals(req.getRequirePromotion()))
                .build());
    }

    @Transactional(readOnly = true)
    public Sale getReceipt(Long saleId) {
        return saleRepository.findWithLinesById(saleId).orElseThrow(() -> NotFoundException.of("Sale", saleId));
    }

    @Transactional(readOnly = true)
    public List<Sale> recent(int limit) {
        List<Sale> sales = saleRepository.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit)));
        // touch lines while the session is open
        sales.forEach(s -> s.getLines().size());
        return sales;
    }

    private BigDecimal taxRateOf(CheckoutRequest req) {
        BigDecimal rate = req.getTaxRate() == null ? props.getSales().getDefaultTaxRate() : req.getTaxRate();
        SaleFinalizer.checkTaxRate(rate);
        return rate;
    }
}
