package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.module.MeetingModuleConfig;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.reference.PerDiemRecord;
import com.barthel.progcost.domain.model.reference.TransportRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Meetings and workshops: per diems of every attendee and, when a vehicle is
 * configured, a typical round trip for each attendee who travels.
 */
@Component
public class MeetingCostModule implements CostModule<MeetingModuleConfig> {

    @Override
    public List<CostLineItem> compute(MeetingModuleConfig config, CostingContext context, int year) {
        PerDiemRecord perDiem = context.store().perDiem(context.country());
        BigDecimal meetingDays = BigDecimal.valueOf((long) config.days() * config.meetingsPerYear());

        MoneyAt allowances = null;
        int travellers = 0;
        for (MeetingModuleConfig.Attendee group : config.attendees()) {
            MoneyAt groupCost = perDiem.rate(config.level(), group.local())
                    .times(BigDecimal.valueOf(group.count()))
                    .times(meetingDays);
            allowances = allowances == null
                    ? groupCost
                    : MoneyAt.of(allowances.amount().add(groupCost.amount()), allowances.currency(), allowances.year());
            if (group.needsTravel()) {
                travellers += group.count();
            }
        }

        List<CostLineItem> items = new ArrayList<>();
        items.add(new CostLineItem("meetings: " + config.label() + " per diem", allowances));
        if (config.vehicleModel() != null && !config.vehicleModel().isBlank()) {
            TransportRecord vehicle = context.store().transport(config.vehicleModel());
            BigDecimal kilometres = context.store().distance(context.country()).typicalRoundTrip()
                    .multiply(BigDecimal.valueOf((long) travellers * config.meetingsPerYear()));
            items.add(new CostLineItem("meetings: " + config.label() + " travel",
                    vehicle.operatingCostPerKmAt().times(kilometres)));
        }
        return items;
    }

    @Override
    public Class<MeetingModuleConfig> configType() {
        return MeetingModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.MEETINGS;
    }
}
