package com.example.poscore.cart;

import com.example.poscore.common.PosException;
import lombok.Getter;

/** Raised while assembling a cart when a line would exceed the product's stock. */
@Getter
public class InsufficientStockException extends PosException {

    private final Long productId;
    private final int requested;
    private final int available;

    public InsufficientStockException(Long productId, int requested, int available) {
        super("Insufficient stock for product " + productId + ": requested " + requested + ", available "
                + available);
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }
}
