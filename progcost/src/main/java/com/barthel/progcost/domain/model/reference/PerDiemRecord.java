package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.exception.NotFoundException;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.module.DivisionLevel;

import java.math.BigDecimal;

/**
 * Daily subsistence allowances of a country. National rates apply in the capital,
 * upper rates at provincial level and lower rates at district level.
 *
 * @param localProportion share of the rate paid to local staff
 */
public record PerDiemRecord(
        String country,
        BigDecimal dsaNational,
        BigDecimal dsaUpper,
        BigDecimal dsaLower,
        String currency,
        int year,
        BigDecimal localProportion) {

    /**
     * @return the tabulated rate for the level, {@code null} if the table leaves it empty
     */
    public BigDecimal dsa(DivisionLevel level) {
        return switch (level) {
            case NATIONAL -> dsaNational;
            case PROVINCIAL -> dsaUpper;
            case DISTRICT -> dsaLower;
        };
    }

    /**
     * Daily rate paid to a traveller at the given level; local staff receive
     * {@code localProportion} of it.
     *
     * @throws NotFoundException if the table leaves the rate or the local proportion empty
     */
    public MoneyAt rate(DivisionLevel level, boolean local) {
        BigDecimal dsa = dsa(level);
        if (dsa == null) {
            throw new NotFoundException(ReferenceDataStore.PER_DIEMS, country + "/" + level.id());
        }
        if (local) {
            if (localProportion == null) {
                throw new NotFoundException(ReferenceDataStore.PER_DIEMS, country + "/local_proportion");
            }
            dsa = dsa.multiply(localProportion);
        }
        return MoneyAt.of(dsa, currency, year);
    }
}
