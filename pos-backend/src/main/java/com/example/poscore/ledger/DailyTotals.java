package com.example.poscore.ledger;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Income (sales + deposits) and expenses (expenses + withdrawals) of one calendar day. */
@Getter
public final class DailyTotals {
    private final LocalDate date;
    private final BigDecimal income;
    private final BigDecimal expenses;

    public DailyTotals(LocalDate date, BigDecimal income, BigDecimal expenses) {
        this.date = date;
        this.income = income;
        this.expenses = expenses;
    }

    public BigDecimal getNet() {
        return income.subtract(expenses);
    }
}
