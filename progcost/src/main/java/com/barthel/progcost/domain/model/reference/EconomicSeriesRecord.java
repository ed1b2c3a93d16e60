package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.exception.MissingSeriesException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * One economic series of one country, covering 1960 to 2021.
 */
public record EconomicSeriesRecord(String country, EconomicSeries series, NavigableMap<Integer, BigDecimal> yearlyValues) {

    public static final int FIRST_YEAR = 1960;
    public static final int LAST_YEAR = 2021;

    public EconomicSeriesRecord {
        yearlyValues = Collections.unmodifiableNavigableMap(new TreeMap<>(yearlyValues));
    }

    /**
     * Value for a year, clamped to the series coverage.
     *
     * @throws MissingSeriesException if the series holds no value at all
     */
    public BigDecimal valueAt(int year) {
        BigDecimal value = YearSeries.nearest(yearlyValues, year, FIRST_YEAR, LAST_YEAR);
        if (value == null) {
            throw new MissingSeriesException(country, series);
        }
        return value;
    }
}
