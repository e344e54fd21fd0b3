package com.example.poscore.promotion;

import com.example.poscore.common.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PromotionKind {
    PERCENTAGE("percentage"),
    FIXED_AMOUNT("fixed_amount"),
    BUY_X_GET_Y("buy_x_get_y"),
    BUNDLE("bundle");

    private final String code;

    PromotionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PromotionKind fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Promotion kind is required");
        }
        for (PromotionKind k : values()) {
            if (k.code.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value)) {
                return k;
            }
        }
        throw new ValidationException("Unknown promotion kind: " + value);
    }
}
