package com.barthel.progcost.domain.model;

import com.barthel.progcost.domain.model.module.ModuleType;

import java.math.BigDecimal;

/**
 * Audit record for a single line item: where it came from and how it was normalised.
 *
 * @param year         programme year
 * @param module       producing module
 * @param component    ledger label
 * @param raw          amount as produced by the module
 * @param rebased      amount in the desired currency and year, before discounting
 * @param presentValue discounted amount
 */
public record LineItemTrace(
        int year,
        ModuleType module,
        String component,
        MoneyAt raw,
        BigDecimal rebased,
        BigDecimal presentValue) {
}
