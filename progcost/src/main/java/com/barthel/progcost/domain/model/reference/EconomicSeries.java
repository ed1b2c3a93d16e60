package com.barthel.progcost.domain.model.reference;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * World Bank series held in the economic statistics table.
 */
public enum EconomicSeries {
    PPP_CONVERSION_FACTOR("PPP conversion factor, GDP (LCU per international $)"),
    GDP_DEFLATOR("GDP deflator (base year varies by country)"),
    GDP_PER_CAPITA_PPP("GDP per capita, PPP (current international $)");

    private final String label;

    EconomicSeries(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolve a stored series name, accepting either the enum name or the World Bank label.
     */
    public static Optional<EconomicSeries> fromStoredName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(s -> s.name().equals(trimmed.toUpperCase(Locale.ROOT)) || s.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
