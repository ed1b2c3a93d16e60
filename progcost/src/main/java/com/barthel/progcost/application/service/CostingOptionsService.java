package com.barthel.progcost.application.service;

import com.barthel.progcost.application.port.in.DescribeCostingOptionsUseCase;
import com.barthel.progcost.application.port.out.LoadReferenceDataPort;
import com.barthel.progcost.config.ProgrammeDefaults;
import com.barthel.progcost.domain.model.CostingOptions;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.reference.ReferenceDataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives the selectable countries and currencies from the reference data.
 */
@Service
@RequiredArgsConstructor
public class CostingOptionsService implements DescribeCostingOptionsUseCase {

    private final LoadReferenceDataPort loadReferenceDataPort;
    private final ProgrammeDefaults programmeDefaults;

    @Override
    public CostingOptions describeOptions() {
        ReferenceDataStore store = loadReferenceDataPort.loadReferenceData();
        return new CostingOptions(
                store.countryCodes(),
                store.currencyCodes(),
                List.of(ModuleType.values()),
                programmeDefaults.get());
    }
}
