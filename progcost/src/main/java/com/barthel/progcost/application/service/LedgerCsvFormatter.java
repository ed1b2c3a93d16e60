package com.barthel.progcost.application.service;

import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.CostLedgerEntry;
import com.barthel.progcost.domain.model.LineItemTrace;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Writes ledgers as comma separated tables. Amounts are fixed-point plain strings so
 * the output does not depend on the JVM locale.
 */
@Component
public class LedgerCsvFormatter {

    static final String[] LEDGER_HEADER = {"year", "component", "cost", "currency", "price_year"};
    static final String[] TRACE_HEADER = {
            "year", "module", "component", "raw_amount", "raw_currency", "raw_year", "rebased", "present_value"};

    private static final int COST_SCALE = 2;
    private static final int TRACE_SCALE = 6;

    public String format(CostLedger ledger) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, csvFormat(LEDGER_HEADER))) {
            for (CostLedgerEntry entry : ledger.entries()) {
                printer.printRecord(
                        entry.year(),
                        entry.component(),
                        fixed(entry.cost(), COST_SCALE),
                        ledger.currency(),
                        ledger.priceYear());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ledger", e);
        }
        return out.toString();
    }

    public String formatTrace(CostLedger ledger) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, csvFormat(TRACE_HEADER))) {
            for (LineItemTrace line : ledger.trace()) {
                printer.printRecord(
                        line.year(),
                        line.module().id(),
                        line.component(),
                        fixed(line.raw().amount(), TRACE_SCALE),
                        line.raw().currency(),
                        line.raw().year(),
                        fixed(line.rebased(), TRACE_SCALE),
                        fixed(line.presentValue(), TRACE_SCALE));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ledger trace", e);
        }
        return out.toString();
    }

    static String fixed(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    private static CSVFormat csvFormat(String[] header) {
        return CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setRecordSeparator('\n')
                .build();
    }
}
