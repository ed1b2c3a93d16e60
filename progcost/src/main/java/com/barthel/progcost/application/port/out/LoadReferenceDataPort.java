package com.barthel.progcost.application.port.out;

import com.barthel.progcost.domain.model.reference.ReferenceDataStore;

/**
 * Port for obtaining the reference data snapshot used by costing runs.
 */
public interface LoadReferenceDataPort {
    /**
     * Load the reference tables. Implementations may cache the snapshot since it is immutable.
     *
     * @return the read-only snapshot
     */
    ReferenceDataStore loadReferenceData();
}
