package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

/**
 * Office supplies and furniture bought each year.
 *
 * @param items catalogue items and quantities
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SuppliesModuleConfig(List<SupplyItem> items) implements ModuleConfig {
    public SuppliesModuleConfig {
        if (items == null || items.isEmpty()) {
            throw new ConfigException("Supplies module needs at least one item");
        }
        items = List.copyOf(items);
    }

    @Override
    public ModuleType type() {
        return ModuleType.SUPPLIES;
    }

    /**
     * @param item            catalogue item name
     * @param quantity        units, defaults to one
     * @param usefulLifeYears when set, the purchase is annualised over this many years
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SupplyItem(String item, BigDecimal quantity, Integer usefulLifeYears) {
        public SupplyItem {
            if (item == null || item.isBlank()) {
                throw new ConfigException("Supply item name is required");
            }
            if (quantity == null) {
                quantity = BigDecimal.ONE;
            }
            if (quantity.signum() < 0) {
                throw new ConfigException("Quantity must not be negative for " + item.trim());
            }
            if (usefulLifeYears != null && usefulLifeYears <= 0) {
                throw new ConfigException("Useful life must be positive for " + item.trim());
            }
        }
    }
}
