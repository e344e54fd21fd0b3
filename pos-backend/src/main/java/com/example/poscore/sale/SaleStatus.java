package com.example.poscore.sale;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a sale. Only {@link #COMPLETED} and {@link #FAILED} are ever
 * stored; the other states exist while a cart is priced and committed.
 */
public enum SaleStatus {
    DRAFT("draft"),
    PRICING("pricing"),
    COMMITTING("committing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    SaleStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(SaleStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SaleStatus> allowedNext() {
        return switch (this) {
            case DRAFT -> EnumSet.of(PRICING);
            case PRICING -> EnumSet.of(DRAFT, COMMITTING);
            case COMMITTING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(SaleStatus.class);
        };
    }

    public static SaleStatus fromCode(String code) {
        for (SaleStatus s : values()) {
            if (s.code.equalsIgnoreCase(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown sale status: " + code);
    }
}
