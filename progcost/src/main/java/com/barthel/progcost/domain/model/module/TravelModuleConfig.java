package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Trips paid through daily subsistence allowances.
 *
 * @param trips the recurring trips
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TravelModuleConfig(List<Trip> trips) implements ModuleConfig {
    public TravelModuleConfig {
        if (trips == null || trips.isEmpty()) {
            throw new ConfigException("Travel module needs at least one trip");
        }
        trips = List.copyOf(trips);
    }

    @Override
    public ModuleType type() {
        return ModuleType.TRAVEL;
    }

    /**
     * @param level        division level of the destination, selects the DSA tier
     * @param local        whether the travellers are local staff
     * @param travellers   people per trip
     * @param days         days per trip
     * @param tripsPerYear trips per programme year
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Trip(DivisionLevel level, boolean local, int travellers, int days, int tripsPerYear) {
        public Trip {
            if (level == null) {
                throw new ConfigException("Trip division level is required");
            }
            if (travellers < 0 || days < 0 || tripsPerYear < 0) {
                throw new ConfigException("Trip counts must not be negative");
            }
        }
    }
}
