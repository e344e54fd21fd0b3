package com.example.poscore.sale;

import com.example.poscore.common.PosException;
import lombok.Getter;

/**
 * Stock changed between pricing and commit: another sale took the units this
 * one counted on.
 */
@Getter
public class StockConflictException extends PosException {

    private final CommitStep step;
    private final Long productId;
    private final int requested;
    private final int available;

    public StockConflictException(CommitStep step, Long productId, int requested, int available) {
        super("Stock changed for product " + productId + ": requested " + requested + ", available " + available);
        this.step = step;
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }
}
