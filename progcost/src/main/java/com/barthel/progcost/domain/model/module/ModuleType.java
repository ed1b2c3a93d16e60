package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Identifiers of the available cost modules.
 */
public enum ModuleType {
    PERSONNEL("personnel"),
    TRAVEL("travel"),
    TRANSPORT("transport"),
    SUPPLIES("supplies"),
    FACILITY_DISTRIBUTION("facility_distribution"),
    LOGISTICS("logistics"),
    MEETINGS("meetings");

    private final String id;

    ModuleType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ModuleType fromId(String id) {
        String wanted = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(wanted))
                .findFirst()
                .orElseThrow(() -> new ConfigException("Unknown module identifier: " + id));
    }
}
