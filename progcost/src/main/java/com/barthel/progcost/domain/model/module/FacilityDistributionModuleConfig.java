package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

/**
 * Material placed in every facility of the selected types, e.g. wall posters.
 *
 * @param label                        ledger label, defaults to the item name
 * @param item                         catalogue item supplying the unit price
 * @param unitsPerSite                 units per facility or office, defaults to one
 * @param facilities                   facility types receiving the material
 * @param includeAdministrativeOffices also supply the national, provincial and district offices
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FacilityDistributionModuleConfig(
        String label,
        String item,
        BigDecimal unitsPerSite,
        List<FacilityType> facilities,
        boolean includeAdministrativeOffices) implements ModuleConfig {

    public FacilityDistributionModuleConfig {
        if (item == null || item.isBlank()) {
            throw new ConfigException("Facility distribution needs a catalogue item");
        }
        facilities = facilities == null ? List.of() : List.copyOf(facilities);
        if (facilities.isEmpty() && !includeAdministrativeOffices) {
            throw new ConfigException("Facility distribution needs facilities or administrative offices");
        }
        if (unitsPerSite == null) {
            unitsPerSite = BigDecimal.ONE;
        }
        if (unitsPerSite.signum() < 0) {
            throw new ConfigException("Units per site must not be negative");
        }
        if (label == null || label.isBlank()) {
            label = item.trim();
        }
    }

    @Override
    public ModuleType type() {
        return ModuleType.FACILITY_DISTRIBUTION;
    }
}
