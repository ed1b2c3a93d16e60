package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Statistical / administrative level at which an activity takes place.
 */
public enum DivisionLevel {
    NATIONAL(50_000_000L),
    PROVINCIAL(5_000_000L),
    DISTRICT(500_000L);

    private final long standardPopulation;

    DivisionLevel(long standardPopulation) {
        this.standardPopulation = standardPopulation;
    }

    /**
     * Population of one division of this level in the standardised country that
     * staffing norms are written for.
     */
    public long standardPopulation() {
        return standardPopulation;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive parse, so {@code "National"}, {@code "PROVINCIAL"} and {@code "district"} all resolve.
     */
    @JsonCreator
    public static DivisionLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Division level is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown division level: " + value);
        }
    }
}
