package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of healthcare facility counted in the facilities table.
 */
public enum FacilityType {
    REGIONAL_HOSPITAL,
    PROVINCIAL_HOSPITAL,
    DISTRICT_HOSPITAL,
    HEALTH_CENTRE,
    HEALTH_POST;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FacilityType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Facility type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown facility type: " + value);
        }
    }
}
