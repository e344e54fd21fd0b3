package com.example.poscore.promotion;

import com.example.poscore.common.ValidationException;

import java.util.Collection;
import java.util.Set;

/**
 * Kind-specific conditions of a promotion. Each variant carries only the
 * fields its kind reads; {@link #of} refuses fields that belong to another
 * kind.
 */
public abstract class PromotionConditions {

    private static final None NONE = new None();

    private PromotionConditions() {
    }

    public static PromotionConditions of(PromotionKind kind, Integer buyQuantity, Integer getQuantity,
            Collection<Long> bundleProductIds) {
        boolean hasBuyGet = buyQuantity != null || getQuantity != null;
        boolean hasBundle = bundleProductIds != null && !bundleProductIds.isEmpty();
        return switch (kind) {
            case PERCENTAGE, FIXED_AMOUNT -> {
                if (hasBuyGet || hasBundle) {
                    throw new ValidationException(
                            "Promotion kind " + kind.getCode() + " does not take buy/get or bundle conditions");
                }
                yield NONE;
            }
            case BUY_X_GET_Y -> {
                if (hasBundle) {
                    throw new ValidationException("Promotion kind buy_x_get_y does not take bundle products");
                }
                yield new BuyXGetY(buyQuantity, getQuantity);
            }
            case BUNDLE -> {
                if (hasBuyGet) {
                    throw new ValidationException("Promotion kind bundle does not take buy/get quantities");
                }
                yield new Bundle(bundleProductIds);
            }
        };
    }

    /** Percentage and fixed-amount promotions carry no extra conditions. */
    public static final class None extends PromotionConditions {
        private None() {
        }
    }

    public static final class BuyXGetY extends PromotionConditions {
        private final int buyQuantity;
        private final int getQuantity;

        public BuyXGetY(Integer buyQuantity, Integer getQuantity) {
            if (buyQuantity == null || buyQuantity <= 0) {
                throw new ValidationException("Buy quantity must be greater than zero");
            }
            if (getQuantity == null || getQuantity <= 0) {
                throw new ValidationException("Free quantity must be greater than zero");
            }
            this.buyQuantity = buyQuantity;
            this.getQuantity = getQuantity;
        }

        public int getBuyQuantity() {
            return buyQuantity;
        }

        public int getGetQuantity() {
            return getQuantity;
        }

        /** Free units earned by {@code quantity} purchased units, never more than bought. */
        public int freeUnits(int quantity) {
            long earned = (long) (quantity / buyQuantity) * getQuantity;
            return (int) Math.min(earned, quantity);
        }
    }

    public static final class Bundle extends PromotionConditions {
        private final Set<Long> productIds;

        public Bundle(Collection<Long> productIds) {
            if (productIds == null || productIds.isEmpty()) {
                throw new ValidationException("A bundle promotion needs at least one product");
            }
            this.productIds = Set.copyOf(productIds);
        }

        public Set<Long> getProductIds() {
            return productIds;
        }
    }
}
