package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Vehicle fleet operated by the programme. Distance comes from
 * {@code kilometresPerYear} when set, otherwise from {@code tripsPerYear} round trips
 * between typical regions, otherwise from a flat monthly mileage.
 *
 * @param vehicleModel      model name in the transport catalogue
 * @param vehicles          number of vehicles, defaults to one
 * @param kilometresPerYear explicit annual distance per vehicle
 * @param tripsPerYear      inter-regional round trips per vehicle and year
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransportModuleConfig(
        String vehicleModel,
        Integer vehicles,
        BigDecimal kilometresPerYear,
        BigDecimal tripsPerYear) implements ModuleConfig {

    public TransportModuleConfig {
        if (vehicleModel == null || vehicleModel.isBlank()) {
            throw new ConfigException("Transport module needs a vehicle model");
        }
        if (vehicles == null) {
            vehicles = 1;
        }
        if (vehicles < 0) {
            throw new ConfigException("Vehicle count must not be negative");
        }
        if (kilometresPerYear != null && kilometresPerYear.signum() < 0
                || tripsPerYear != null && tripsPerYear.signum() < 0) {
            throw new ConfigException("Transport distance and trips must not be negative");
        }
    }

    @Override
    public ModuleType type() {
        return ModuleType.TRANSPORT;
    }
}
