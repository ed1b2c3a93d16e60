package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.model.module.DivisionLevel;

/**
 * Number of first and second level sub-national divisions of a country.
 */
public record AdministrativeDivisionRecord(String country, int provincialDivisions, int districtDivisions) {

    public int divisions(DivisionLevel level) {
        return switch (level) {
            case NATIONAL -> 1;
            case PROVINCIAL -> provincialDivisions;
            case DISTRICT -> districtDivisions;
        };
    }
}
