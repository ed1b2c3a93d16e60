package com.barthel.progcost.domain.exception;

import com.barthel.progcost.domain.model.reference.EconomicSeries;
import lombok.Getter;

/**
 * A country has no usable entry for an economic series. Years outside the
 * tabulated range are clamped and never raise this.
 */
@Getter
public class MissingSeriesException extends ReferenceDataException {

    private final String country;
    private final EconomicSeries series;

    public MissingSeriesException(String country, EconomicSeries series) {
        super("No " + series.label() + " series for " + country);
        this.country = country;
        this.series = series;
    }
}
