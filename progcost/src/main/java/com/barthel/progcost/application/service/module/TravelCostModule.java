package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.module.TravelModuleConfig;
import com.barthel.progcost.domain.model.reference.PerDiemRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Per diems paid for recurring trips.
 */
@Component
public class TravelCostModule implements CostModule<TravelModuleConfig> {

    @Override
    public List<CostLineItem> compute(TravelModuleConfig config, CostingContext context, int year) {
        PerDiemRecord perDiem = context.store().perDiem(context.country());
        List<CostLineItem> items = new ArrayList<>();
        for (TravelModuleConfig.Trip trip : config.trips()) {
            MoneyAt rate = perDiem.rate(trip.level(), trip.local());
            long travellerDays = (long) trip.travellers() * trip.days() * trip.tripsPerYear();
            items.add(new CostLineItem(component(trip), rate.times(BigDecimal.valueOf(travellerDays))));
        }
        return items;
    }

    private static String component(TravelModuleConfig.Trip trip) {
        return "travel: " + trip.level().id() + (trip.local() ? " local" : " visiting") + " per diem";
    }

    @Override
    public Class<TravelModuleConfig> configType() {
        return TravelModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.TRAVEL;
    }
}
