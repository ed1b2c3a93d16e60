package com.barthel.progcost.application.service;

import com.barthel.progcost.application.port.in.CostProgrammeUseCase;
import com.barthel.progcost.application.port.out.LoadReferenceDataPort;
import com.barthel.progcost.application.service.module.CostModuleRouter;
import com.barthel.progcost.application.service.module.CostingContext;
import com.barthel.progcost.config.ProgcostProperties;
import com.barthel.progcost.domain.exception.ConfigException;
import com.barthel.progcost.domain.exception.CostingInterruptedException;
import com.barthel.progcost.domain.exception.DataGapException;
import com.barthel.progcost.domain.exception.ReferenceDataException;
import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.CostLedgerEntry;
import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.CurrencyCodes;
import com.barthel.progcost.domain.model.LineItemTrace;
import com.barthel.progcost.domain.model.ProgrammeConfig;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import com.barthel.progcost.domain.model.reference.ReferenceDataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Costs a programme year by year: every configured module is computed, each line
 * item is rebased to the desired currency and year, discounted to the start year
 * and summed per component.
 */
@Service
@RequiredArgsConstructor
public class ProgrammeCostingService implements CostProgrammeUseCase {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final int FIRST_PRICE_YEAR = 1960;
    private static final int LAST_PRICE_YEAR = 2100;

    private final LoadReferenceDataPort loadReferenceDataPort;
    private final CostModuleRouter costModuleRouter;
    private final ProgcostProperties properties;

    @Override
    public CostLedger costProgramme(ProgrammeConfig config) {
        ReferenceDataStore store = loadReferenceDataPort.loadReferenceData();
        CurrencyTimeRebaser rebaser = new CurrencyTimeRebaser(store, properties.rebasing().deflatorCountry());
        validate(config, store, rebaser);

        CostingContext context = CostingContext.of(config.country(), store);
        Map<Integer, Map<String, BigDecimal>> totals = new TreeMap<>();
        List<LineItemTrace> trace = new ArrayList<>();

        for (int year = config.startYear(); year <= config.endYear(); year++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CostingInterruptedException(year);
            }
            BigDecimal discountFactor = discountFactor(config.discountRate(), year - config.startYear());
            Map<String, BigDecimal> yearTotals = totals.computeIfAbsent(year, y -> new TreeMap<>());
            for (ModuleConfig module : config.modules()) {
                for (CostLineItem item : costModuleRouter.compute(module, context, year)) {
                    BigDecimal rebased = rebase(rebaser, item, module, config);
                    BigDecimal presentValue = rebased.divide(discountFactor, MC);
                    yearTotals.merge(item.component(), presentValue, BigDecimal::add);
                    trace.add(new LineItemTrace(year, module.type(), item.component(), item.money(), rebased, presentValue));
                }
            }
        }

        List<CostLedgerEntry> entries = new ArrayList<>();
        totals.forEach((year, byComponent) ->
                byComponent.forEach((component, cost) -> entries.add(new CostLedgerEntry(year, component, cost))));
        return new CostLedger(CurrencyCodes.display(config.desiredCurrency()), config.desiredYear(), entries, trace);
    }

    /**
     * {@code (1 + rate)^elapsedYears}
     */
    static BigDecimal discountFactor(BigDecimal rate, int elapsedYears) {
        return BigDecimal.ONE.add(rate).pow(elapsedYears, MC);
    }

    private static BigDecimal rebase(CurrencyTimeRebaser rebaser, CostLineItem item, ModuleConfig module,
                                     ProgrammeConfig config) {
        try {
            return rebaser.rebase(item.money(), config.desiredCurrency(), config.desiredYear()).amount();
        } catch (ReferenceDataException e) {
            throw new DataGapException(module.type(), config.country(), e);
        }
    }

    private static void validate(ProgrammeConfig config, ReferenceDataStore store, CurrencyTimeRebaser rebaser) {
        if (!store.countryCodes().contains(config.country())) {
            throw new ConfigException("Unknown country code: " + config.country());
        }
        if (!rebaser.supportsCurrency(config.desiredCurrency())) {
            throw new ConfigException("Unknown currency code: " + config.desiredCurrency());
        }
        if (config.desiredYear() < FIRST_PRICE_YEAR || config.desiredYear() > LAST_PRICE_YEAR) {
            throw new ConfigException("Desired year must be between " + FIRST_PRICE_YEAR
                    + " and " + LAST_PRICE_YEAR + ", was " + config.desiredYear());
        }
    }
}
