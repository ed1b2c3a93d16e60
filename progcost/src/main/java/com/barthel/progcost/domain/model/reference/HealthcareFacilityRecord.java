package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.model.module.FacilityType;

/**
 * Facility counts of a country's health system.
 */
public record HealthcareFacilityRecord(
        String country,
        int regionalHospitals,
        int provincialHospitals,
        int districtHospitals,
        int healthCentres,
        int healthPosts) {

    public int count(FacilityType type) {
        return switch (type) {
            case REGIONAL_HOSPITAL -> regionalHospitals;
            case PROVINCIAL_HOSPITAL -> provincialHospitals;
            case DISTRICT_HOSPITAL -> districtHospitals;
            case HEALTH_CENTRE -> healthCentres;
            case HEALTH_POST -> healthPosts;
        };
    }
}
