package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.module.TransportModuleConfig;
import com.barthel.progcost.domain.model.reference.TransportRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Operating cost of the programme's vehicles.
 */
@Component
public class TransportCostModule implements CostModule<TransportModuleConfig> {

    /**
     * Mileage assumed when neither a distance nor a trip count is configured: 2000 km a month.
     */
    static final BigDecimal DEFAULT_KILOMETRES_PER_YEAR = BigDecimal.valueOf(2000L * 12);

    @Override
    public List<CostLineItem> compute(TransportModuleConfig config, CostingContext context, int year) {
        TransportRecord vehicle = context.store().transport(config.vehicleModel());
        BigDecimal kilometres = kilometresPerVehicle(config, context).multiply(BigDecimal.valueOf(config.vehicles()));
        return List.of(new CostLineItem("transport: " + vehicle.vehicleModel(),
                vehicle.operatingCostPerKmAt().times(kilometres)));
    }

    private static BigDecimal kilometresPerVehicle(TransportModuleConfig config, CostingContext context) {
        if (config.kilometresPerYear() != null) {
            return config.kilometresPerYear();
        }
        if (config.tripsPerYear() != null) {
            return context.store().distance(context.country()).typicalRoundTrip().multiply(config.tripsPerYear());
        }
        return DEFAULT_KILOMETRES_PER_YEAR;
    }

    @Override
    public Class<TransportModuleConfig> configType() {
        return TransportModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.TRANSPORT;
    }
}
