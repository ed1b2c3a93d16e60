package com.barthel.progcost.application.service.module;

import com.barthel.progcost.application.service.PopulationResolver;
import com.barthel.progcost.domain.model.reference.ReferenceDataStore;

/**
 * Per-run inputs shared by all cost modules.
 *
 * @param country    ISO3 code of the programme country
 * @param store      reference snapshot of the run
 * @param population population lookups on the same snapshot
 */
public record CostingContext(String country, ReferenceDataStore store, PopulationResolver population) {

    public static CostingContext of(String country, ReferenceDataStore store) {
        return new CostingContext(country, store, new PopulationResolver(store));
    }
}
