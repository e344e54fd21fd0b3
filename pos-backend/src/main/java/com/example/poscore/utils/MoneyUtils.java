package com.example.poscore.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary amounts are BigDecimal with two decimals, rounded half-up whenever a
 * multiplication produces more precision.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;

    private MoneyUtils() {
    }

    public static BigDecimal money(BigDecimal value) {
        return value == null ? zero() : value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal money(String value) {
        return money(new BigDecimal(value));
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
