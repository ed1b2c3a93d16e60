package com.barthel.progcost.domain.exception;

import com.barthel.progcost.domain.model.module.ModuleType;
import lombok.Getter;

/**
 * A cost module could not produce its line items because reference data is missing.
 */
@Getter
public class DataGapException extends CostingException {

    private final ModuleType module;
    private final String country;

    public DataGapException(ModuleType module, String country, ReferenceDataException cause) {
        super("Module '" + module.id() + "' cannot be costed for " + country + ": " + cause.getMessage(), cause);
        this.module = module;
        this.country = country;
    }
}
