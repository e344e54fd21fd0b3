package com.example.poscore.sale;

/** Steps of a sale commit, in execution order. */
public enum CommitStep {
    VALIDATE,
    REVALIDATE_STOCK,
    CLAIM_PROMOTION,
    COMPUTE_TOTALS,
    PERSIST_SALE,
    DECREMENT_STOCK,
    RECORD_PROMOTION_USAGE,
    APPEND_LEDGER
}
