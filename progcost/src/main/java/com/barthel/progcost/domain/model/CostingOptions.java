package com.barthel.progcost.domain.model;

import com.barthel.progcost.domain.model.module.ModuleType;

import java.util.List;

/**
 * Selectable values offered to callers building a {@link ProgrammeConfig}.
 *
 * @param countries  ISO3 codes present in the reference data
 * @param currencies currency codes accepted as desired currency
 * @param modules    available module identifiers
 * @param defaults   configuration used for omitted request fields
 */
public record CostingOptions(
        List<String> countries,
        List<String> currencies,
        List<ModuleType> modules,
        ProgrammeConfig defaults) {
}
