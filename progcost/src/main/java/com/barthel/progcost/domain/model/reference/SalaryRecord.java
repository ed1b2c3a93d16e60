package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.model.MoneyAt;

import java.math.BigDecimal;

/**
 * Annual salary of a cadre in a country.
 */
public record SalaryRecord(String country, int cadreLevel, BigDecimal annualSalary, String currency, int year) {

    public MoneyAt annualSalaryAt() {
        return MoneyAt.of(annualSalary, currency, year);
    }
}
