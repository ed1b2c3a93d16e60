package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.SuppliesModuleConfig;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.barthel.progcost.support.ReferenceDataFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;

class OfficeSuppliesCostModuleTest {

    private final OfficeSuppliesCostModule module = new OfficeSuppliesCostModule();
    private final CostingContext context = CostingContext.of("AAA", ReferenceDataFixtures.store());

    @Test
    void durableItemsAreAnnualisedAndConsumablesAreNot() {
        SuppliesModuleConfig config = new SuppliesModuleConfig(List.of(
                new SuppliesModuleConfig.SupplyItem("Computer", bd("5"), 10),
                new SuppliesModuleConfig.SupplyItem("Paper", bd("1000"), null)));

        List<CostLineItem> items = module.compute(config, context, 2020);

        assertThat(items).extracting(CostLineItem::component)
                .containsExactly("supplies: Computer", "supplies: Paper");
        assertThat(items.get(0).money().amount()).isEqualByComparingTo("500");
        assertThat(items.get(1).money().amount()).isEqualByComparingTo("10");
    }
}
