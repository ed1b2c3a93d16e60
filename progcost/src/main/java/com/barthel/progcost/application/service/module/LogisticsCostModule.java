package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.DivisionLevel;
import com.barthel.progcost.domain.model.module.LogisticsModuleConfig;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.reference.TransportRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Round trips to every division of a level, plus trips proportional to population.
 * Each trip covers twice the typical inter-regional distance.
 */
@Component
public class LogisticsCostModule implements CostModule<LogisticsModuleConfig> {

    @Override
    public List<CostLineItem> compute(LogisticsModuleConfig config, CostingContext context, int year) {
        TransportRecord vehicle = context.store().transport(config.vehicleModel());
        BigDecimal roundTrip = context.store().distance(context.country()).typicalRoundTrip();
        BigDecimal trips = trips(config, context, year);
        return List.of(new CostLineItem("logistics: " + config.level().id() + " visits",
                vehicle.operatingCostPerKmAt().times(roundTrip.multiply(trips))));
    }

    static BigDecimal trips(LogisticsModuleConfig config, CostingContext context, int year) {
        BigDecimal trips = BigDecimal.ZERO;
        if (config.visitsPerDivision().signum() > 0) {
            int divisions = config.level() == DivisionLevel.NATIONAL
                    ? 1
                    : context.store().administrativeDivisions(context.country()).divisions(config.level());
            trips = trips.add(config.visitsPerDivision().multiply(BigDecimal.valueOf(divisions)));
        }
        if (config.visitsPerMillionPopulation().signum() > 0) {
            BigDecimal millions = context.population().resolveMillions(context.country(), year);
            trips = trips.add(config.visitsPerMillionPopulation().multiply(millions));
        }
        return trips;
    }

    @Override
    public Class<LogisticsModuleConfig> configType() {
        return LogisticsModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.LOGISTICS;
    }
}
