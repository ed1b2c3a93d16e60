package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.MoneyAt;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.module.SuppliesModuleConfig;
import com.barthel.progcost.domain.model.reference.SupplyRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Office supplies and furniture. Durable items with a useful life are annualised.
 */
@Component
public class OfficeSuppliesCostModule implements CostModule<SuppliesModuleConfig> {

    @Override
    public List<CostLineItem> compute(SuppliesModuleConfig config, CostingContext context, int year) {
        List<CostLineItem> items = new ArrayList<>();
        for (SuppliesModuleConfig.SupplyItem item : config.items()) {
            SupplyRecord supply = context.store().supply(item.item());
            MoneyAt cost = supply.priceAt().times(item.quantity());
            if (item.usefulLifeYears() != null) {
                cost = cost.dividedBy(BigDecimal.valueOf(item.usefulLifeYears()));
            }
            items.add(new CostLineItem("supplies: " + supply.item(), cost));
        }
        return items;
    }

    @Override
    public Class<SuppliesModuleConfig> configType() {
        return SuppliesModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.SUPPLIES;
    }
}
