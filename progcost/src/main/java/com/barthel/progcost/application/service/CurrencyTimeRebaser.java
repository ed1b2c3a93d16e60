package com.barthel.progcost.application.service;

import com.barthel.progcost.domain.exception.MissingSeriesException;
import com.barthel.progcost.domain.model.CurrencyCodes;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.reference.EconomicSeries;
import com.barthel.progcost.domain.model.reference.EconomicSeriesRecord;
import com.barthel.progcost.domain.model.reference.ReferenceDataStore;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Moves amounts between currencies and price years.
 * <p>
 * The chain runs through international dollars: the source amount is divided by
 * the source country's PPP conversion factor for the source year, inflated with the
 * GDP deflator of the reference economy, then multiplied by the target country's
 * PPP factor for the target year. Years outside 1960-2021 are clamped to the
 * nearest tabulated year.
 * <p>
 * Local currency targets are therefore inflated with the reference economy's
 * deflator, not with the target country's own price index.
 */
public class CurrencyTimeRebaser {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final ReferenceDataStore store;
    private final String deflatorCountry;

    /**
     * @param store           reference snapshot
     * @param deflatorCountry country whose GDP deflator moves international dollars between years
     */
    public CurrencyTimeRebaser(ReferenceDataStore store, String deflatorCountry) {
        this.store = store;
        this.deflatorCountry = CurrencyCodes.normalize(deflatorCountry);
    }

    /**
     * Express {@code money} in {@code targetCurrency} at {@code targetYear} prices.
     *
     * @throws MissingSeriesException if a required PPP or deflator series is absent
     */
    public MoneyAt rebase(MoneyAt money, String targetCurrency, int targetYear) {
        BigDecimal factor = factor(money.currency(), money.year(), targetCurrency, targetYear);
        BigDecimal amount = factor.compareTo(BigDecimal.ONE) == 0
                ? money.amount()
                : money.amount().multiply(factor, MC);
        return MoneyAt.of(amount, CurrencyCodes.display(targetCurrency), targetYear);
    }

    /**
     * Multiplicative conversion factor between two currency and year pairs.
     */
    public BigDecimal factor(String sourceCurrency, int sourceYear, String targetCurrency, int targetYear) {
        String source = CurrencyCodes.normalize(sourceCurrency);
        String target = CurrencyCodes.normalize(targetCurrency);
        if (source.equals(target) && sourceYear == targetYear) {
            return BigDecimal.ONE;
        }
        BigDecimal factor = BigDecimal.ONE;
        if (!CurrencyCodes.isInternational(source)) {
            factor = factor.divide(ppp(source, sourceYear), MC);
        }
        factor = factor.multiply(deflation(sourceYear, targetYear), MC);
        if (!CurrencyCodes.isInternational(target)) {
            factor = factor.multiply(ppp(target, targetYear), MC);
        }
        return factor;
    }

    /**
     * Whether amounts can be converted into the given currency.
     */
    public boolean supportsCurrency(String currency) {
        String code = CurrencyCodes.normalize(currency);
        return CurrencyCodes.isInternational(code)
                || CurrencyCodes.UNITED_STATES.equals(code)
                || store.hasEconomicSeries(code, EconomicSeries.PPP_CONVERSION_FACTOR);
    }

    private BigDecimal deflation(int sourceYear, int targetYear) {
        if (sourceYear == targetYear) {
            return BigDecimal.ONE;
        }
        EconomicSeriesRecord deflator = store.economicSeries(deflatorCountry, EconomicSeries.GDP_DEFLATOR);
        return deflator.valueAt(targetYear).divide(deflator.valueAt(sourceYear), MC);
    }

    private BigDecimal ppp(String country, int year) {
        // the US dollar is the international dollar's numeraire
        if (CurrencyCodes.UNITED_STATES.equals(country)
                && !store.hasEconomicSeries(country, EconomicSeries.PPP_CONVERSION_FACTOR)) {
            return BigDecimal.ONE;
        }
        return store.economicSeries(country, EconomicSeries.PPP_CONVERSION_FACTOR).valueAt(year);
    }
}
