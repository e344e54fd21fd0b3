package com.example.poscore.sale;

import com.example.poscore.common.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

/** How the customer paid. Recorded on the sale only; no gateway is involved. */
public enum PaymentMethod {
    CASH("cash"),
    CARD("card"),
    TRANSFER("transfer");

    private final String code;

    PaymentMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PaymentMethod fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Payment method is required");
        }
        for (PaymentMethod m : values()) {
            if (m.code.equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new ValidationException("Unsupported payment method: " + value + " (cash|card|transfer)");
    }
}
