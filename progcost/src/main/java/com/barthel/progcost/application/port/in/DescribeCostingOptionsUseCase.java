package com.barthel.progcost.application.port.in;

import com.barthel.progcost.domain.model.CostingOptions;

/**
 * Use case listing the values a programme configuration may use.
 */
public interface DescribeCostingOptionsUseCase {
    /**
     * @return countries, currencies, modules and defaults
     */
    CostingOptions describeOptions();
}
