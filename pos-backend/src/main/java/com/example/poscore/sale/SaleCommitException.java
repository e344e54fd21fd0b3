package com.example.poscore.sale;

import com.example.poscore.common.PosException;
import lombok.Getter;

/** Unexpected failure while committing a sale; everything the commit wrote was rolled back. */
@Getter
public class SaleCommitException extends PosException {

    private final CommitStep step;

    public SaleCommitException(CommitStep step, Throwable cause) {
        super("Sale commit failed at " + step + ": " + cause.getMessage(), cause);
        this.step = step;
    }
}
