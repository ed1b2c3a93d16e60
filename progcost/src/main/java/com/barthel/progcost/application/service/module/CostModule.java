package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.exception.ReferenceDataException;
import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import com.barthel.progcost.domain.model.module.ModuleType;

import java.util.List;

/**
 * A kind of programme cost. Modules look up reference data and return line items
 * tagged with the currency and price year of their source; rebasing happens later.
 *
 * @param <C> configuration accepted by the module
 */
public interface CostModule<C extends ModuleConfig> {

    /**
     * Computes the raw cost line items of one programme year.
     *
     * @param config  module parameters
     * @param context country and reference data of the run
     * @param year    programme year
     * @return line items in source currency and year
     * @throws ReferenceDataException if a required reference row is missing
     */
    List<CostLineItem> compute(C config, CostingContext context, int year);

    /**
     * @return the configuration class this module accepts
     */
    Class<C> configType();

    /**
     * Whether this implementation handles the given module type.
     *
     * @param type the type to check
     * @return true if supported
     */
    boolean supports(ModuleType type);
}
