package com.barthel.progcost.domain.model;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * One row of the cost ledger, expressed in the desired currency and price year.
 *
 * @param year      programme year
 * @param component cost component label
 * @param cost      discounted cost
 */
public record CostLedgerEntry(int year, String component, BigDecimal cost) {

    public static final Comparator<CostLedgerEntry> LEDGER_ORDER =
            Comparator.comparingInt(CostLedgerEntry::year).thenComparing(CostLedgerEntry::component);

    public CostLedgerEntry {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("Component is required");
        }
        if (cost == null) {
            throw new IllegalArgumentException("Cost is required");
        }
    }
}
