package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.module.DivisionLevel;
import com.barthel.progcost.domain.model.module.FacilityDistributionModuleConfig;
import com.barthel.progcost.domain.model.module.FacilityType;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.reference.AdministrativeDivisionRecord;
import com.barthel.progcost.domain.model.reference.HealthcareFacilityRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Material placed in each healthcare facility, and optionally in each administrative
 * office, of the country.
 */
@Component
public class FacilityDistributionCostModule implements CostModule<FacilityDistributionModuleConfig> {

    @Override
    public List<CostLineItem> compute(FacilityDistributionModuleConfig config, CostingContext context, int year) {
        MoneyAt perSite = context.store().supply(config.item()).priceAt().times(config.unitsPerSite());
        List<CostLineItem> items = new ArrayList<>();
        if (!config.facilities().isEmpty()) {
            HealthcareFacilityRecord facilities = context.store().healthcareFacilities(context.country());
            for (FacilityType type : config.facilities()) {
                items.add(new CostLineItem(config.label() + ": " + type.id(),
                        perSite.times(BigDecimal.valueOf(facilities.count(type)))));
            }
        }
        if (config.includeAdministrativeOffices()) {
            AdministrativeDivisionRecord divisions = context.store().administrativeDivisions(context.country());
            int offices = 0;
            for (DivisionLevel level : DivisionLevel.values()) {
                offices += divisions.divisions(level);
            }
            items.add(new CostLineItem(config.label() + ": administrative offices",
                    perSite.times(BigDecimal.valueOf(offices))));
        }
        return items;
    }

    @Override
    public Class<FacilityDistributionModuleConfig> configType() {
        return FacilityDistributionModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.FACILITY_DISTRIBUTION;
    }
}
