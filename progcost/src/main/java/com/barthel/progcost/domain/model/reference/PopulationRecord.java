package com.barthel.progcost.domain.model.reference;

import java.math.BigDecimal;

/**
 * UN population estimate or projection for a country and year, in thousands.
 */
public record PopulationRecord(String country, int year, String variant, BigDecimal valueInThousands) {

    public static final String MEDIAN_VARIANT = "Median";
    public static final int FIRST_YEAR = 1950;
    public static final int LAST_YEAR = 2100;
}
