package com.example.poscore.ledger;

import com.example.poscore.common.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Kind of a cash movement. Sales and deposits add to the balance, expenses
 * and withdrawals subtract from it.
 */
public enum LedgerEntryKind {
    SALE("sale", 1),
    DEPOSIT("deposit", 1),
    EXPENSE("expense", -1),
    WITHDRAWAL("withdrawal", -1);

    private final String code;
    private final int sign;

    LedgerEntryKind(String code, int sign) {
        this.code = code;
        this.sign = sign;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isIncome() {
        return sign > 0;
    }

    /** Amount with this kind's sign applied. */
    public BigDecimal signed(BigDecimal amount) {
        return sign > 0 ? amount : amount.negate();
    }

    /** Kinds a user may record by hand; sale entries come only from a commit. */
    public boolean isManual() {
        return this != SALE;
    }

    @JsonCreator
    public static LedgerEntryKind fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Movement kind is required");
        }
        for (LedgerEntryKind k : values()) {
            if (k.code.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value)) {
                return k;
            }
        }
        throw new ValidationException("Unknown movement kind: " + value);
    }
}
