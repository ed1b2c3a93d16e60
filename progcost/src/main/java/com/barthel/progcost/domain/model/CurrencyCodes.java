package com.barthel.progcost.domain.model;

import java.util.Locale;

/**
 * Normalisation rules for currency codes. Local currencies are identified by the
 * ISO3 code of their country; {@code USD} is an alias of the United States.
 */
public final class CurrencyCodes {

    public static final String INTERNATIONAL_DOLLAR = "I$";
    public static final String US_DOLLAR = "USD";
    public static final String UNITED_STATES = "USA";

    private CurrencyCodes() {
    }

    /**
     * Map a user or table supplied currency code to the key used for series lookups.
     */
    public static String normalize(String code) {
        if (code == null) {
            return null;
        }
        String upper = code.trim().toUpperCase(Locale.ROOT);
        if (US_DOLLAR.equals(upper)) {
            return UNITED_STATES;
        }
        if ("INT".equals(upper) || "INT$".equals(upper)) {
            return INTERNATIONAL_DOLLAR;
        }
        return upper;
    }

    public static boolean isInternational(String code) {
        return INTERNATIONAL_DOLLAR.equals(normalize(code));
    }

    /**
     * The code shown to users: the United States is presented as {@code USD}.
     */
    public static String display(String code) {
        String normalized = normalize(code);
        return UNITED_STATES.equals(normalized) ? US_DOLLAR : normalized;
    }
}
