package com.barthel.progcost.adapter.in.web.dto;

import com.barthel.progcost.domain.model.ProgrammeConfig;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Programme costing request. Every field is optional; missing fields take the configured defaults.
 * {@code discount_rate} is a fraction, e.g. {@code 0.03} for three percent a year.
 */
public record ProgrammeCostRequestDto(
        String country,
        @JsonProperty("start_year") Integer startYear,
        @JsonProperty("end_year") Integer endYear,
        @JsonProperty("discount_rate") BigDecimal discountRate,
        @JsonProperty("desired_currency") String desiredCurrency,
        @JsonProperty("desired_year") Integer desiredYear,
        List<ModuleConfig> modules) {

    public ProgrammeConfig toConfig(ProgrammeConfig defaults) {
        return new ProgrammeConfig(
                country != null ? country : defaults.country(),
                startYear != null ? startYear : defaults.startYear(),
                endYear != null ? endYear : defaults.endYear(),
                discountRate != null ? discountRate : defaults.discountRate(),
                desiredCurrency != null ? desiredCurrency : defaults.desiredCurrency(),
                desiredYear != null ? desiredYear : defaults.desiredYear(),
                modules != null ? modules : defaults.modules());
    }
}
