package com.barthel.progcost.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of a costing run.
 *
 * @param currency  display code of the currency all costs are expressed in
 * @param priceYear price year all costs are expressed in
 * @param entries   ledger rows ordered by year, then component
 * @param trace     per line item audit trail, in computation order
 */
public record CostLedger(String currency, int priceYear, List<CostLedgerEntry> entries, List<LineItemTrace> trace) {
    public CostLedger {
        entries = List.copyOf(entries);
        trace = List.copyOf(trace);
    }

    public BigDecimal total() {
        return entries.stream()
                .map(CostLedgerEntry::cost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Map<Integer, BigDecimal> totalsByYear() {
        Map<Integer, BigDecimal> totals = new TreeMap<>();
        for (CostLedgerEntry entry : entries) {
            totals.merge(entry.year(), entry.cost(), BigDecimal::add);
        }
        return totals;
    }
}
