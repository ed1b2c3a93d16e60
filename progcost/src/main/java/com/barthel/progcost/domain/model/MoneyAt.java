package com.barthel.progcost.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * A monetary amount together with the currency and price year it is expressed in.
 *
 * @param amount   the amount
 * @param currency currency code, either an ISO3 country code, {@code USD} or {@code I$}
 * @param year     the price year
 */
public record MoneyAt(BigDecimal amount, String currency, int year) {
    public MoneyAt {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        currency = currency.trim();
    }

    public static MoneyAt of(BigDecimal amount, String currency, int year) {
        return new MoneyAt(amount, currency, year);
    }

    /**
     * Scale the amount, keeping its provenance.
     */
    public MoneyAt times(BigDecimal factor) {
        return new MoneyAt(amount.multiply(factor), currency, year);
    }

    public MoneyAt dividedBy(BigDecimal divisor) {
        return new MoneyAt(amount.divide(divisor, MathContext.DECIMAL64), currency, year);
    }
}
