package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.model.MoneyAt;

import java.math.BigDecimal;

/**
 * Operating characteristics of a vehicle model.
 */
public record TransportRecord(
        String vehicleModel,
        BigDecimal operatingCostPerKm,
        BigDecimal consumptionLitresPerKm,
        String currency,
        int year) {

    public TransportRecord {
        vehicleModel = vehicleModel == null ? null : vehicleModel.trim();
    }

    public MoneyAt operatingCostPerKmAt() {
        return MoneyAt.of(operatingCostPerKm, currency, year);
    }
}
