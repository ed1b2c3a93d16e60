package com.barthel.progcost.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "progcost")
public record ProgcostProperties(
        @Valid @NotNull Defaults defaults,
        @Valid @NotNull Rebasing rebasing
) {
    /**
     * Values used for fields a programme request leaves out.
     */
    public record Defaults(
            @NotBlank String country,
            @NotNull Integer startYear,
            @NotNull Integer endYear,
            @NotNull BigDecimal discountRate,
            @NotBlank String desiredCurrency,
            @NotNull Integer desiredYear,
            @NotBlank String modulesTemplate
    ) {
    }

    public record Rebasing(
            @NotBlank String deflatorCountry
    ) {
    }
}
