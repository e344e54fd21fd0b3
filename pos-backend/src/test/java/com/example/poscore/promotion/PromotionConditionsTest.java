package com.example.poscore.promotion;

import com.example.poscore.common.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromotionConditionsTest {

    @Test
    void percentageAndFixedCarryNoConditions() {
        assertThat(PromotionConditions.of(PromotionKind.PERCENTAGE, null, null, null))
                .isInstanceOf(PromotionConditions.None.class);
        assertThat(PromotionConditions.of(PromotionKind.FIXED_AMOUNT, null, null, List.of()))
                .isInstanceOf(PromotionConditions.None.class);
    }

    @Test
    void fieldsOfAnotherKindAreRejected() {
        assertThatThrownBy(() -> PromotionConditions.of(PromotionKind.PERCENTAGE, 2, 1, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PromotionConditions.of(PromotionKind.BUY_X_GET_Y, 2, 1, List.of(5L)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PromotionConditions.of(PromotionKind.BUNDLE, 2, null, List.of(5L)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void buyXGetYRequiresPositiveQuantities() {
        assertThatThrownBy(() -> PromotionConditions.of(PromotionKind.BUY_X_GET_Y, 0, 1, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PromotionConditions.of(PromotionKind.BUY_X_GET_Y, 2, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void freeUnitsNeverExceedPurchasedUnits() {
        PromotionConditions.BuyXGetY buy2get1 = new PromotionConditions.BuyXGetY(2, 1);
        assertThat(buy2get1.freeUnits(1)).isZero();
        assertThat(buy2get1.freeUnits(3)).isEqualTo(1);
        assertThat(buy2get1.freeUnits(4)).isEqualTo(2);

        PromotionConditions.BuyXGetY buy1get5 = new PromotionConditions.BuyXGetY(1, 5);
        assertThat(buy1get5.freeUnits(2)).isEqualTo(2);
    }

    @Test
    void hugeFreeQuantityIsCappedInsteadOfOverflowing() {
        PromotionConditions.BuyXGetY generous = new PromotionConditions.BuyXGetY(1, Integer.MAX_VALUE);

        assertThat(generous.freeUnits(2)).isEqualTo(2);
        assertThat(generous.freeUnits(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
        assertThat(new PromotionConditions.BuyXGetY(3, Integer.MAX_VALUE).freeUnits(2)).isZero();
    }

    @Test
    void bundleNeedsAtLeastOneProduct() {
        assertThatThrownBy(() -> PromotionConditions.of(PromotionKind.BUNDLE, null, null, List.of()))
                .isInstanceOf(ValidationException.class);
        PromotionConditions.Bundle bundle = (PromotionConditions.Bundle) PromotionConditions
                .of(PromotionKind.BUNDLE, null, null, List.of(1L, 2L, 2L));
        assertThat(bundle.getProductIds()).containsExactlyInAnyOrder(1L, 2L);
    }
}
