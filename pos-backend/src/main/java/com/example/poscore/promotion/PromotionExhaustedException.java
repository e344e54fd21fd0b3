package com.example.poscore.promotion;

import com.example.poscore.common.PosException;
import lombok.Getter;

/**
 * The promotion could not be claimed at commit: its usage cap was reached, or
 * it was deactivated or expired after the cart was priced.
 */
@Getter
public class PromotionExhaustedException extends PosException {

    private final Long promotionId;

    public PromotionExhaustedException(Long promotionId) {
        super("Promotion " + promotionId + " is no longer available");
        this.promotionId = promotionId;
    }
}
