package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

/**
 * Salaried staff employed by the programme.
 *
 * @param staff one entry per cadre employed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PersonnelModuleConfig(List<Staff> staff) implements ModuleConfig {
    public PersonnelModuleConfig {
        if (staff == null || staff.isEmpty()) {
            throw new ConfigException("Personnel module needs at least one staff entry");
        }
        staff = List.copyOf(staff);
    }

    @Override
    public ModuleType type() {
        return ModuleType.PERSONNEL;
    }

    /**
     * @param cadreLevel   ISCO-08 skill level, 1 (services) to 5 (managers)
     * @param headcount    full-time equivalents, defaults to one
     * @param label        optional display name used in the ledger
     * @param standardized headcount is given per division of a standardised population
     *                     and is fitted to the country's real population
     * @param level        division level the standardised headcount refers to
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Staff(int cadreLevel, BigDecimal headcount, String label, boolean standardized,
                        DivisionLevel level) {
        public Staff {
            if (cadreLevel < 1 || cadreLevel > 5) {
                throw new ConfigException("Cadre level must be between 1 and 5, was " + cadreLevel);
            }
            if (headcount == null) {
                headcount = BigDecimal.ONE;
            }
            if (headcount.signum() < 0) {
                throw new ConfigException("Headcount must not be negative");
            }
            if (standardized && level == null) {
                throw new ConfigException("Standardised headcount needs a division level");
            }
        }
    }
}
