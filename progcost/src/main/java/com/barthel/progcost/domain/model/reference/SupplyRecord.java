package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.model.MoneyAt;

import java.math.BigDecimal;

/**
 * Catalogue price of an office supply or furniture item. The item name is stored trimmed.
 */
public record SupplyRecord(String item, BigDecimal price, String currency, int year) {

    public SupplyRecord {
        item = item == null ? null : item.trim();
    }

    public MoneyAt priceAt() {
        return MoneyAt.of(price, currency, year);
    }
}
