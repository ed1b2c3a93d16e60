package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Supervision or delivery round trips to every division of a level, optionally
 * scaled with population.
 *
 * @param vehicleModel               vehicle used for the round trips
 * @param level                      divisions visited
 * @param visitsPerDivision          round trips per division and year
 * @param visitsPerMillionPopulation additional round trips per million inhabitants and year
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LogisticsModuleConfig(
        String vehicleModel,
        DivisionLevel level,
        BigDecimal visitsPerDivision,
        BigDecimal visitsPerMillionPopulation) implements ModuleConfig {

    public LogisticsModuleConfig {
        if (vehicleModel == null || vehicleModel.isBlank()) {
            throw new ConfigException("Logistics module needs a vehicle model");
        }
        if (level == null) {
            level = DivisionLevel.DISTRICT;
        }
        if (visitsPerDivision == null) {
            visitsPerDivision = BigDecimal.ZERO;
        }
        if (visitsPerMillionPopulation == null) {
            visitsPerMillionPopulation = BigDecimal.ZERO;
        }
        if (visitsPerDivision.signum() < 0 || visitsPerMillionPopulation.signum() < 0) {
            throw new ConfigException("Visit rates must not be negative");
        }
    }

    @Override
    public ModuleType type() {
        return ModuleType.LOGISTICS;
    }
}
