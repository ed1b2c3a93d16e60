package com.barthel.progcost.adapter.in.web.controller;

import com.barthel.progcost.adapter.in.web.dto.CostingOptionsDto;
import com.barthel.progcost.adapter.in.web.dto.ProgrammeCostRequestDto;
import com.barthel.progcost.application.port.in.CostProgrammeUseCase;
import com.barthel.progcost.application.port.in.DescribeCostingOptionsUseCase;
import com.barthel.progcost.application.service.LedgerCsvFormatter;
import com.barthel.progcost.config.ProgrammeDefaults;
import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.ProgrammeConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/programme-costs")
@RequiredArgsConstructor
@Slf4j
public class ProgrammeCostController {

    static final String TEXT_CSV = "text/csv";

    private final CostProgrammeUseCase costProgrammeUseCase;
    private final DescribeCostingOptionsUseCase describeCostingOptionsUseCase;
    private final ProgrammeDefaults programmeDefaults;
    private final LedgerCsvFormatter ledgerCsvFormatter;

    @PostMapping(produces = TEXT_CSV)
    public String costProgramme(@RequestBody(required = false) ProgrammeCostRequestDto request) {
        return ledgerCsvFormatter.format(run(request));
    }

    @PostMapping(path = "/trace", produces = TEXT_CSV)
    public String traceProgramme(@RequestBody(required = false) ProgrammeCostRequestDto request) {
        return ledgerCsvFormatter.formatTrace(run(request));
    }

    @GetMapping("/options")
    public CostingOptionsDto options() {
        return CostingOptionsDto.from(describeCostingOptionsUseCase.describeOptions());
    }

    private CostLedger run(ProgrammeCostRequestDto request) {
        ProgrammeConfig defaults = programmeDefaults.get();
        ProgrammeConfig config = request == null ? defaults : request.toConfig(defaults);
        log.info("Costing programme for country={}, years={}-{}, modules={}",
                config.country(), config.startYear(), config.endYear(), config.modules().size());
        CostLedger ledger = costProgrammeUseCase.costProgramme(config);
        log.debug("Programme total {} {} at {} prices over {} entries",
                ledger.total(), ledger.currency(), ledger.priceYear(), ledger.entries().size());
        return ledger;
    }
}
