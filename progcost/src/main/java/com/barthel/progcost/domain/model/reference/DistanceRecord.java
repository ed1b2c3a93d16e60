package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.exception.NotFoundException;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Percentiles of the distance between a country's regions, in km.
 *
 * @param percentileDistances percentile (10, 20, ... 90, 95, 100) to distance
 * @param sizeKmSq            land area, may be {@code null}
 */
public record DistanceRecord(String country, Map<Integer, BigDecimal> percentileDistances, BigDecimal sizeKmSq) {

    public static final int TYPICAL_PERCENTILE = 95;

    public DistanceRecord {
        percentileDistances = new TreeMap<>(percentileDistances);
    }

    /**
     * @return the distance for the percentile, {@code null} when not tabulated
     */
    public BigDecimal distance(int percentile) {
        return percentileDistances.get(percentile);
    }

    /**
     * The 95th percentile distance used as the typical inter-regional trip length.
     *
     * @throws NotFoundException if the percentile is not tabulated for the country
     */
    public BigDecimal typicalInterRegionalDistance() {
        BigDecimal distance = distance(TYPICAL_PERCENTILE);
        if (distance == null) {
            throw new NotFoundException(ReferenceDataStore.DISTANCES, country + "/DDist" + TYPICAL_PERCENTILE);
        }
        return distance;
    }

    /**
     * Length of a round trip between two typical regions.
     */
    public BigDecimal typicalRoundTrip() {
        return typicalInterRegionalDistance().multiply(BigDecimal.valueOf(2));
    }
}
