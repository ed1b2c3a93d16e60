package com.barthel.progcost.adapter.in.web.dto;

import com.barthel.progcost.domain.model.CostingOptions;
import com.barthel.progcost.domain.model.ProgrammeConfig;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record CostingOptionsDto(
        List<String> countries,
        List<String> currencies,
        List<String> modules,
        Defaults defaults) {

    public static CostingOptionsDto from(CostingOptions options) {
        ProgrammeConfig config = options.defaults();
        return new CostingOptionsDto(
                options.countries(),
                options.currencies(),
                options.modules().stream().map(ModuleType::id).toList(),
                new Defaults(
                        config.country(),
                        config.startYear(),
                        config.endYear(),
                        config.discountRate(),
                        config.desiredCurrency(),
                        config.desiredYear(),
                        config.modules()));
    }

    public record Defaults(
            String country,
            @JsonProperty("start_year") int startYear,
            @JsonProperty("end_year") int endYear,
            @JsonProperty("discount_rate") BigDecimal discountRate,
            @JsonProperty("desired_currency") String desiredCurrency,
            @JsonProperty("desired_year") int desiredYear,
            List<ModuleConfig> modules) {
    }
}
