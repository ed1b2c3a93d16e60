package com.barthel.progcost.domain.model;

/**
 * Raw output of a cost module, still in its source currency and price year.
 *
 * @param component ledger label, e.g. {@code personnel: cadre 4}
 * @param money     the un-rebased amount
 */
public record CostLineItem(String component, MoneyAt money) {
    public CostLineItem {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("Component is required");
        }
        if (money == null) {
            throw new IllegalArgumentException("Money is required");
        }
    }
}
