package com.barthel.progcost.application.service;

import com.barthel.progcost.domain.exception.NotFoundException;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PopulationResolverTest {

    private final PopulationResolver resolver = new PopulationResolver(ReferenceDataFixtures.store());

    @Test
    void resolvesTabulatedYears() {
        assertThat(resolver.resolve("AAA", 2019)).isEqualByComparingTo("1000");
        assertThat(resolver.resolvePersons("AAA", 2020)).isEqualByComparingTo("2000000");
        assertThat(resolver.resolveMillions("AAA", 2021)).isEqualByComparingTo("3");
    }

    @Test
    void yearsOutsideProjectionRangeResolveToBoundary() {
        assertThat(resolver.resolve("AAA", 1900)).isEqualByComparingTo("500");
        assertThat(resolver.resolve("AAA", 2200)).isEqualByComparingTo("9000");
    }

    @Test
    void gapsResolveToNearestTabulatedYear() {
        assertThat(resolver.resolve("AAA", 2050)).isEqualByComparingTo("3000");
    }

    @Test
    void countryWithoutPopulationIsReported() {
        assertThatThrownBy(() -> resolver.resolve("BBB", 2020)).isInstanceOf(NotFoundException.class);
    }
}
