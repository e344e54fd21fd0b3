package com.example.poscore.promotion;

import com.example.poscore.utils.MoneyUtils;

import java.math.BigDecimal;

/** Human-readable promotion wording for listings and receipts. */
public final class PromotionTexts {

    static final String NO_ELIGIBLE_PRODUCTS = "No eligible products for this promotion";
    static final String BUNDLE_INCOMPLETE = "Products missing to complete the bundle";

    private PromotionTexts() {
    }

    public static String preview(Promotion p) {
        return switch (p.getKind()) {
            case PERCENTAGE -> percent(p.getValue()) + "% off";
            case FIXED_AMOUNT -> amount(p.getValue()) + " off";
            case BUY_X_GET_Y -> buyGet(p);
            case BUNDLE -> "Bundle with " + amount(p.getValue()) + " off";
        };
    }

    static String applied(Promotion p) {
        return switch (p.getKind()) {
            case PERCENTAGE -> percent(p.getValue()) + "% off eligible products";
            case FIXED_AMOUNT -> "Fixed discount of " + amount(p.getValue());
            case BUY_X_GET_Y -> buyGet(p);
            case BUNDLE -> "Special bundle discount";
        };
    }

    private static String buyGet(Promotion p) {
        int buy = p.getBuyQuantity() == null ? 1 : p.getBuyQuantity();
        int get = p.getGetQuantity() == null ? 1 : p.getGetQuantity();
        return "Buy " + buy + " get " + get + " free";
    }

    private static String percent(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static String amount(BigDecimal value) {
        return MoneyUtils.money(value).toPlainString();
    }
}
