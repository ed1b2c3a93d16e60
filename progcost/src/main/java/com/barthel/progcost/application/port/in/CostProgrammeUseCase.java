package com.barthel.progcost.application.port.in;

import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.ProgrammeConfig;

/**
 * Use case for costing a programme over its year range.
 */
public interface CostProgrammeUseCase {
    /**
     * Computes the discounted cost ledger of a programme. Either the complete ledger is
     * returned or an exception is raised; partial results are never produced.
     *
     * @param config the programme configuration
     * @return the resulting {@link CostLedger}
     */
    CostLedger costProgramme(ProgrammeConfig config);
}
