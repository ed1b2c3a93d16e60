package com.barthel.progcost.application.service;

import com.barthel.progcost.domain.exception.NotFoundException;
import com.barthel.progcost.domain.model.reference.PopulationRecord;
import com.barthel.progcost.domain.model.reference.ReferenceDataStore;
import com.barthel.progcost.domain.model.reference.YearSeries;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Population of a country in a year, from the median UN projection variant.
 * Years outside 1950-2100 resolve to the boundary year.
 */
public class PopulationResolver {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final ReferenceDataStore store;

    public PopulationResolver(ReferenceDataStore store) {
        this.store = store;
    }

    /**
     * @return population in thousands
     * @throws NotFoundException if the country has no population rows
     */
    public BigDecimal resolve(String country, int year) {
        BigDecimal value = YearSeries.nearest(store.population(country, PopulationRecord.MEDIAN_VARIANT),
                year, PopulationRecord.FIRST_YEAR, PopulationRecord.LAST_YEAR);
        if (value == null) {
            throw new NotFoundException(ReferenceDataStore.POPULATION, country + "/" + year);
        }
        return value;
    }

    public BigDecimal resolvePersons(String country, int year) {
        return resolve(country, year).multiply(THOUSAND);
    }

    public BigDecimal resolveMillions(String country, int year) {
        return resolve(country, year).divide(THOUSAND, MathContext.DECIMAL64);
    }
}
