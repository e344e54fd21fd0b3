package com.example.poscore.promotion;

import com.example.poscore.cart.CartLine;
import com.example.poscore.utils.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prices promotions against a cart and picks the one to apply.
 * <p>
 * A promotion is considered only when it is valid (active, inside its
 * {@code [start, end)} window, minimum purchase met, usage cap not reached)
 * and grants a positive discount over its eligible lines. Exactly one
 * promotion is applied per sale: the largest discount wins and ties go to the
 * promotion listed first. Stateless apart from the clock.
 */
@Component
public class PromotionEvaluator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;

    public PromotionEvaluator(Clock clock) {
        this.clock = clock;
    }

    /** Best promotion for the cart, or empty when none grants a discount. */
    public Optional<PromotionResult> evaluate(List<Promotion> promotions, List<CartLine> lines, BigDecimal subtotal) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PromotionResult best = null;
        for (Promotion promotion : promotions) {
            if (!isValid(promotion, subtotal, now)) {
                continue;
            }
            PromotionResult result = calculate(promotion, lines);
            if (!result.isApplicable()) {
                continue;
            }
            // strictly greater: an equal discount later in the list never replaces the first
            if (best == null || result.getDiscountAmount().compareTo(best.getDiscountAmount()) > 0) {
                best = result;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Every valid promotion with a positive discount, largest discount first. */
    public List<PromotionResult> applicable(List<Promotion> promotions, List<CartLine> lines, BigDecimal subtotal) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<PromotionResult> results = new ArrayList<>();
        for (Promotion promotion : promotions) {
            if (isValid(promotion, subtotal, now)) {
                PromotionResult result = calculate(promotion, lines);
                if (result.isApplicable()) {
                    results.add(result);
                }
            }
        }
        // List.sort is stable, so equal discounts keep input order
        results.sort(Comparator.comparing(PromotionResult::getDiscountAmount).reversed());
        return results;
    }

    public boolean isValid(Promotion promotion, BigDecimal subtotal) {
        return isValid(promotion, subtotal, OffsetDateTime.now(clock));
    }

    boolean isValid(Promotion promotion, BigDecimal subtotal, OffsetDateTime now) {
        if (!Boolean.TRUE.equals(promotion.getActive()))
            return false;
        if (promotion.getStartDate() == null || promotion.getEndDate() == null)
            return false;
        if (now.isBefore(promotion.getStartDate()) || !now.isBefore(promotion.getEndDate()))
            return false;
        BigDecimal minPurchase = promotion.getMinPurchaseAmount() == null ? BigDecimal.ZERO
                : promotion.getMinPurchaseAmount();
        if (subtotal.compareTo(minPurchase) < 0)
            return false;
        return !promotion.isExhausted();
    }

    public boolean isEligible(Promotion promotion, CartLine line) {
        if (promotion.isUnrestricted())
            return true;
        if (promotion.getProductIds() != null && promotion.getProductIds().contains(line.getProductId()))
            return true;
        return line.getCategoryId() != null && promotion.getCategoryIds() != null
                && promotion.getCategoryIds().contains(line.getCategoryId());
    }

    /**
     * Discount {@code promotion} grants on {@code lines}, ignoring validity.
     * The result is never larger than the subtotal of the eligible lines.
     */
    public PromotionResult calculate(Promotion promotion, List<CartLine> lines) {
        List<CartLine> eligible = lines.stream().filter(l -> isEligible(promotion, l)).toList();
        if (eligible.isEmpty()) {
            return result(promotion, MoneyUtils.zero(), List.of(), PromotionTexts.NO_ELIGIBLE_PRODUCTS);
        }
        BigDecimal eligibleSubtotal = eligible.stream().map(CartLine::getLineTotal).reduce(BigDecimal.ZERO,
                BigDecimal::add);

        BigDecimal discount;
        List<CartLine> applied;
        String description = PromotionTexts.applied(promotion);
        PromotionConditions conditions = promotion.getConditions();

        switch (promotion.getKind()) {
            case PERCENTAGE -> {
                discount = eligibleSubtotal.multiply(promotion.getValue()).divide(ONE_HUNDRED, MoneyUtils.SCALE,
                        RoundingMode.HALF_UP);
                applied = eligible;
            }
            case FIXED_AMOUNT -> {
                discount = MoneyUtils.min(promotion.getValue(), eligibleSubtotal);
                applied = eligible;
            }
            case BUY_X_GET_Y -> {
                PromotionConditions.BuyXGetY buyGet = (PromotionConditions.BuyXGetY) conditions;
                discount = BigDecimal.ZERO;
                applied = new ArrayList<>();
                for (CartLine line : eligible) {
                    int free = buyGet.freeUnits(line.getQuantity());
                    if (free > 0) {
                        discount = discount.add(line.getUnitPrice().multiply(BigDecimal.valueOf(free)));
                        applied.add(line);
                    }
                }
            }
            case BUNDLE -> {
                Set<Long> required = ((PromotionConditions.Bundle) conditions).getProductIds();
                Set<Long> inCart = lines.stream().map(CartLine::getProductId).collect(Collectors.toSet());
                if (inCart.containsAll(required)) {
                    discount = promotion.getValue();
                    applied = lines.stream().filter(l -> required.contains(l.getProductId())).toList();
                } else {
                    discount = BigDecimal.ZERO;
                    applied = List.of();
                    description = PromotionTexts.BUNDLE_INCOMPLETE;
                }
            }
            default -> throw new IllegalStateException("Unhandled promotion kind " + promotion.getKind());
        }

        discount = MoneyUtils.money(MoneyUtils.min(discount, eligibleSubtotal));
        return result(promotion, discount, List.copyOf(applied), description);
    }

    private static PromotionResult result(Promotion p, BigDecimal discount, List<CartLine> applied,
            String description) {
        return PromotionResult.builder()
                .promotionId(p.getId())
                .promotionName(p.getName())
                .kind(p.getKind())
                .discountAmount(discount)
                .appliedLines(applied)
                .description(description)
                .build();
    }
}
