package com.barthel.progcost.application.service;

import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.CostLedgerEntry;
import com.barthel.progcost.domain.model.LineItemTrace;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.module.ModuleType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.barthel.progcost.support.ReferenceDataFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;

class LedgerCsvFormatterTest {

    private final LedgerCsvFormatter formatter = new LedgerCsvFormatter();

    @Test
    void ledgerRowsCarryCurrencyAndPriceYear() {
        CostLedger ledger = new CostLedger("USD", 2019, List.of(
                new CostLedgerEntry(2020, "personnel: cadre 4", bd("4000")),
                new CostLedgerEntry(2020, "supplies: Paper", bd("1234567.891"))), List.of());

        assertThat(formatter.format(ledger)).isEqualTo(
                "year,component,cost,currency,price_year\n"
                        + "2020,personnel: cadre 4,4000.00,USD,2019\n"
                        + "2020,supplies: Paper,1234567.89,USD,2019\n");
    }

    @Test
    void componentsWithDelimitersAreQuoted() {
        CostLedger ledger = new CostLedger("I$", 2019, List.of(
                new CostLedgerEntry(2021, "meetings: board, annual", bd("0.005"))), List.of());

        assertThat(formatter.format(ledger)).endsWith("2021,\"meetings: board, annual\",0.01,I$,2019\n");
    }

    @Test
    void emptyLedgerStillHasHeader() {
        assertThat(formatter.format(new CostLedger("USD", 2019, List.of(), List.of())))
                .isEqualTo("year,component,cost,currency,price_year\n");
    }

    @Test
    void traceRowsShowRawAndNormalisedAmounts() {
        LineItemTrace line = new LineItemTrace(2021, ModuleType.PERSONNEL, "personnel: cadre 4",
                MoneyAt.of(bd("4000"), "I$", 2019), bd("4000"), bd("3883.4951456"));
        CostLedger ledger = new CostLedger("USD", 2019, List.of(), List.of(line));

        assertThat(formatter.formatTrace(ledger)).isEqualTo(
                "year,module,component,raw_amount,raw_currency,raw_year,rebased,present_value\n"
                        + "2021,personnel,personnel: cadre 4,4000.000000,I$,2019,4000.000000,3883.495146\n");
    }

    @Test
    void fixedPointNeverUsesExponentOrGrouping() {
        assertThat(LedgerCsvFormatter.fixed(bd("1E+7"), 2)).isEqualTo("10000000.00");
        assertThat(LedgerCsvFormatter.fixed(bd("-2.345"), 2)).isEqualTo("-2.35");
    }
}
