package com.barthel.progcost.domain.model;

import com.barthel.progcost.domain.exception.ConfigException;
import com.barthel.progcost.domain.model.module.ModuleConfig;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Everything needed to cost a programme.
 *
 * @param country         ISO3 code of the implementing country
 * @param startYear       first programme year
 * @param endYear         last programme year, inclusive
 * @param discountRate    annual discount rate as a fraction, e.g. 0.03
 * @param desiredCurrency currency of the ledger
 * @param desiredYear     price year of the ledger
 * @param modules         configured cost modules
 */
public record ProgrammeConfig(
        String country,
        int startYear,
        int endYear,
        BigDecimal discountRate,
        String desiredCurrency,
        int desiredYear,
        List<ModuleConfig> modules) {

    public ProgrammeConfig {
        if (country == null || country.isBlank()) {
            throw new ConfigException("Country is required");
        }
        country = country.trim().toUpperCase(Locale.ROOT);
        if (startYear > endYear) {
            throw new ConfigException("Start year " + startYear + " is after end year " + endYear);
        }
        if (discountRate == null || discountRate.signum() < 0) {
            throw new ConfigException("Discount rate must be zero or positive");
        }
        if (desiredCurrency == null || desiredCurrency.isBlank()) {
            throw new ConfigException("Desired currency is required");
        }
        desiredCurrency = desiredCurrency.trim().toUpperCase(Locale.ROOT);
        if (modules == null || modules.isEmpty()) {
            throw new ConfigException("At least one cost module must be configured");
        }
        modules = List.copyOf(modules);
    }

    public int years() {
        return endYear - startYear + 1;
    }
}
