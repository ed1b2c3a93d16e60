package com.barthel.progcost.application.service;

import com.barthel.progcost.application.port.out.LoadReferenceDataPort;
import com.barthel.progcost.application.service.module.CostModuleRouter;
import com.barthel.progcost.application.service.module.OfficeSuppliesCostModule;
import com.barthel.progcost.application.service.module.PersonnelCostModule;
import com.barthel.progcost.application.service.module.TravelCostModule;
import com.barthel.progcost.config.ProgcostProperties;
import com.barthel.progcost.domain.exception.ConfigException;
import com.barthel.progcost.domain.exception.CostingInterruptedException;
import com.barthel.progcost.domain.exception.DataGapException;
import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.CostLedgerEntry;
import com.barthel.progcost.domain.model.ProgrammeConfig;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.module.PersonnelModuleConfig;
import com.barthel.progcost.domain.model.module.SuppliesModuleConfig;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.barthel.progcost.support.ReferenceDataFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProgrammeCostingServiceTest {

    private static final ModuleConfig MANAGER = new PersonnelModuleConfig(List.of(
            new PersonnelModuleConfig.Staff(4, null, null, false, null)));
    private static final ModuleConfig PAPER = new SuppliesModuleConfig(List.of(
            new SuppliesModuleConfig.SupplyItem("Paper", bd("1000"), null)));

    private ProgrammeCostingService service;

    @BeforeEach
    void setUp() {
        LoadReferenceDataPort port = mock(LoadReferenceDataPort.class);
        when(port.loadReferenceData()).thenReturn(ReferenceDataFixtures.store());
        CostModuleRouter router = new CostModuleRouter(List.of(
                new PersonnelCostModule(), new TravelCostModule(), new OfficeSuppliesCostModule()));
        ProgcostProperties properties = new ProgcostProperties(
                new ProgcostProperties.Defaults("AAA", 2019, 2021, bd("0.03"), "USD", 2019,
                        "classpath:templates/default-modules.json"),
                new ProgcostProperties.Rebasing("USA"));
        service = new ProgrammeCostingService(port, router, properties);
    }

    @Test
    void ledgerIsOrderedByYearThenComponent() {
        CostLedger ledger = service.costProgramme(config(BigDecimal.ZERO, "I$", List.of(PAPER, MANAGER)));

        assertThat(ledger.currency()).isEqualTo("I$");
        assertThat(ledger.priceYear()).isEqualTo(2019);
        assertThat(ledger.entries())
                .extracting(e -> e.year() + " " + e.component())
                .containsExactly(
                        "2019 personnel: cadre 4", "2019 supplies: Paper",
                        "2020 personnel: cadre 4", "2020 supplies: Paper",
                        "2021 personnel: cadre 4", "2021 supplies: Paper");
        assertThat(ledger.entries()).isSortedAccordingTo(CostLedgerEntry.LEDGER_ORDER);
        // US dollars at parity with international dollars in the same year
        assertThat(ledger.entries().get(1).cost()).isEqualByComparingTo("10");
        assertThat(ledger.total()).isEqualByComparingTo("12030");
    }

    @Test
    void laterYearsAreDiscountedToTheStartYear() {
        CostLedger ledger = service.costProgramme(config(bd("0.1"), "I$", List.of(MANAGER)));

        List<BigDecimal> costs = ledger.entries().stream().map(CostLedgerEntry::cost).toList();
        assertThat(costs.get(0)).isEqualByComparingTo("4000");
        assertThat(costs.get(1)).isCloseTo(new BigDecimal("3636.3636"), within(new BigDecimal("0.0001")));
        assertThat(costs.get(2)).isCloseTo(new BigDecimal("3305.7851"), within(new BigDecimal("0.0001")));
        assertThat(costs.get(0)).isGreaterThan(costs.get(1));
        assertThat(costs.get(1)).isGreaterThan(costs.get(2));
    }

    @Test
    void identicalComponentsAreSummedPerYear() {
        CostLedger ledger = service.costProgramme(config(BigDecimal.ZERO, "I$", List.of(MANAGER, MANAGER)));

        assertThat(ledger.entries()).hasSize(3)
                .allSatisfy(e -> assertThat(e.cost()).isEqualByComparingTo("8000"));
        assertThat(ledger.trace()).hasSize(6);
        assertThat(ledger.totalsByYear()).containsOnlyKeys(2019, 2020, 2021);
    }

    @Test
    void traceRecordsRawRebasedAndDiscountedAmounts() {
        CostLedger ledger = service.costProgramme(config(bd("0.1"), "USD", List.of(MANAGER)));

        assertThat(ledger.currency()).isEqualTo("USD");
        assertThat(ledger.trace()).hasSize(3).last().satisfies(line -> {
            assertThat(line.year()).isEqualTo(2021);
            assertThat(line.module()).isEqualTo(ModuleType.PERSONNEL);
            assertThat(line.raw().currency()).isEqualTo("I$");
            assertThat(line.raw().amount()).isEqualByComparingTo("4000");
            assertThat(line.rebased()).isEqualByComparingTo("4000");
            assertThat(line.presentValue()).isCloseTo(new BigDecimal("3305.7851"), within(new BigDecimal("0.0001")));
        });
    }

    @Test
    void missingReferenceDataAbortsTheRun() {
        ModuleConfig director = new PersonnelModuleConfig(List.of(new PersonnelModuleConfig.Staff(5, null, null, false, null)));

        assertThatThrownBy(() -> service.costProgramme(config(BigDecimal.ZERO, "I$", List.of(MANAGER, director))))
                .isInstanceOf(DataGapException.class)
                .hasMessageContaining("personnel")
                .hasMessageContaining("AAA");
    }

    @Test
    void unknownCountryCurrencyOrYearIsRejected() {
        assertThatThrownBy(() -> service.costProgramme(new ProgrammeConfig(
                "ZZZ", 2019, 2019, BigDecimal.ZERO, "USD", 2019, List.of(MANAGER))))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("ZZZ");
        assertThatThrownBy(() -> service.costProgramme(config(BigDecimal.ZERO, "CCC", List.of(MANAGER))))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("CCC");
        assertThatThrownBy(() -> service.costProgramme(new ProgrammeConfig(
                "AAA", 2019, 2019, BigDecimal.ZERO, "USD", 1900, List.of(MANAGER))))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void interruptedRunStopsBeforeTheNextYear() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> service.costProgramme(config(BigDecimal.ZERO, "I$", List.of(MANAGER))))
                    .isInstanceOf(CostingInterruptedException.class)
                    .hasMessageContaining("2019");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void discountFactorCompoundsAnnually() {
        assertThat(ProgrammeCostingService.discountFactor(bd("0.03"), 0)).isEqualByComparingTo("1");
        assertThat(ProgrammeCostingService.discountFactor(bd("0.03"), 2)).isEqualByComparingTo("1.0609");
    }

    private static ProgrammeConfig config(BigDecimal discountRate, String currency, List<ModuleConfig> modules) {
        return new ProgrammeConfig("AAA", 2019, 2021, discountRate, currency, 2019, modules);
    }
}
