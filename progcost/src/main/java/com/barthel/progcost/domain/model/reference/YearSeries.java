package com.barthel.progcost.domain.model.reference;

import java.util.Map;
import java.util.NavigableMap;

/**
 * Year-indexed lookup with the boundary policy shared by all tabulated series:
 * the requested year is clamped to the coverage window, then resolved to the
 * nearest year that has a value (the earlier one on ties).
 */
public final class YearSeries {

    private YearSeries() {
    }

    public static int clamp(int year, int firstYear, int lastYear) {
        return Math.max(firstYear, Math.min(lastYear, year));
    }

    /**
     * @return the resolved value, or {@code null} when the series is empty
     */
    public static <V> V nearest(NavigableMap<Integer, V> values, int year, int firstYear, int lastYear) {
        if (values.isEmpty()) {
            return null;
        }
        int wanted = clamp(year, firstYear, lastYear);
        Map.Entry<Integer, V> floor = values.floorEntry(wanted);
        Map.Entry<Integer, V> ceiling = values.ceilingEntry(wanted);
        if (floor == null) {
            return ceiling.getValue();
        }
        if (ceiling == null) {
            return floor.getValue();
        }
        return wanted - floor.getKey() <= ceiling.getKey() - wanted ? floor.getValue() : ceiling.getValue();
    }
}
