package com.barthel.progcost.application.service;

import com.barthel.progcost.domain.exception.MissingSeriesException;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.reference.EconomicSeries;
import com.barthel.progcost.domain.model.reference.ReferenceDataStore;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.barthel.progcost.support.ReferenceDataFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CurrencyTimeRebaserTest {

    private final CurrencyTimeRebaser rebaser = new CurrencyTimeRebaser(ReferenceDataFixtures.store(), "USA");

    @Test
    void sameCurrencyAndYearReturnsAmountUnchanged() {
        MoneyAt money = MoneyAt.of(bd("123.456"), "AAA", 2018);

        MoneyAt rebased = rebaser.rebase(money, "AAA", 2018);

        assertThat(rebased.amount()).isSameAs(money.amount());
        assertThat(rebased.currency()).isEqualTo("AAA");
    }

    @Test
    void usDollarIsAnAliasOfTheUnitedStates() {
        MoneyAt rebased = rebaser.rebase(MoneyAt.of(bd("10"), "USD", 2019), "USA", 2019);

        assertThat(rebased.amount()).isEqualByComparingTo("10");
        assertThat(rebased.currency()).isEqualTo("USD");
    }

    @Test
    void internationalDollarsAreInflatedWithTheReferenceDeflator() {
        MoneyAt rebased = rebaser.rebase(MoneyAt.of(bd("100"), "I$", 2019), "USD", 2020);

        assertThat(rebased.amount()).isEqualByComparingTo("110");
        assertThat(rebased.year()).isEqualTo(2020);
    }

    @Test
    void localCurrencyIsConvertedThroughPurchasingPowerParity() {
        assertThat(rebaser.rebase(MoneyAt.of(bd("100"), "AAA", 2018), "USD", 2018).amount())
                .isEqualByComparingTo("50");
        // 100 / 2.0 * 133.1 / 100 * 15
        assertThat(rebaser.rebase(MoneyAt.of(bd("100"), "AAA", 2018), "BBB", 2021).amount())
                .isEqualByComparingTo("998.25");
    }

    @Test
    void chainedConversionReturnsToTheOriginalAmount() {
        MoneyAt original = MoneyAt.of(bd("100"), "AAA", 2018);

        MoneyAt there = rebaser.rebase(original, "BBB", 2021);
        MoneyAt back = rebaser.rebase(there, "AAA", 2018);

        assertThat(back.amount()).isCloseTo(original.amount(), within(new BigDecimal("0.000000001")));
    }

    @Test
    void yearsBeyondTheSeriesAreClamped() {
        MoneyAt money = MoneyAt.of(bd("100"), "I$", 2018);

        assertThat(rebaser.rebase(money, "USD", 2050).amount())
                .isEqualByComparingTo(rebaser.rebase(money, "USD", 2021).amount());
    }

    @Test
    void missingYearsResolveToTheEarlierNeighbour() {
        // BBB has 2019 = 12 and 2021 = 15, nothing for 2020
        assertThat(rebaser.rebase(MoneyAt.of(bd("1"), "I$", 2020), "BBB", 2020).amount())
                .isEqualByComparingTo("12");
    }

    @Test
    void countryWithoutPppSeriesCannotBeRebased() {
        assertThatThrownBy(() -> rebaser.rebase(MoneyAt.of(bd("1"), "CCC", 2019), "USD", 2019))
                .isInstanceOf(MissingSeriesException.class)
                .hasMessageContaining("CCC");
    }

    @Test
    void supportedCurrenciesFollowThePppSeries() {
        assertThat(rebaser.supportsCurrency("usd")).isTrue();
        assertThat(rebaser.supportsCurrency("I$")).isTrue();
        assertThat(rebaser.supportsCurrency("INT")).isTrue();
        assertThat(rebaser.supportsCurrency("BBB")).isTrue();
        assertThat(rebaser.supportsCurrency("CCC")).isFalse();
    }

    @Test
    void localTargetsAreInflatedWithTheReferenceDeflator() {
        // BBB carries no deflator of its own: 100 * 133.1 / 110 * 15
        assertThat(rebaser.rebase(MoneyAt.of(bd("100"), "I$", 2019), "BBB", 2021).amount())
                .isEqualByComparingTo("181.5");
    }

    @Test
    void blankPppCellsLeaveTheCurrencyUnsupported() {
        ReferenceDataStore withBlanks = ReferenceDataFixtures.builder()
                .economicValue("DDD", EconomicSeries.PPP_CONVERSION_FACTOR, 2019, null)
                .build();

        assertThat(new CurrencyTimeRebaser(withBlanks, "USA").supportsCurrency("DDD")).isFalse();
    }
}
