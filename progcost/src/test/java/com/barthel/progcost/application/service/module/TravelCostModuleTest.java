package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.DivisionLevel;
import com.barthel.progcost.domain.model.module.TravelModuleConfig;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TravelCostModuleTest {

    private final TravelCostModule module = new TravelCostModule();
    private final CostingContext context = CostingContext.of("AAA", ReferenceDataFixtures.store());

    @Test
    void localStaffReceiveTheLocalShareOfTheDistrictRate() {
        TravelModuleConfig config = new TravelModuleConfig(List.of(
                new TravelModuleConfig.Trip(DivisionLevel.DISTRICT, true, 1, 1, 1)));

        List<CostLineItem> items = module.compute(config, context, 2020);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.component()).isEqualTo("travel: district local per diem");
            assertThat(item.money().amount()).isEqualByComparingTo("10");
            assertThat(item.money().currency()).isEqualTo("USD");
        });
    }

    @Test
    void visitingStaffAtNationalLevelPayTheFullRatePerTravellerDay() {
        TravelModuleConfig config = new TravelModuleConfig(List.of(
                new TravelModuleConfig.Trip(DivisionLevel.NATIONAL, false, 3, 4, 2)));

        List<CostLineItem> items = module.compute(config, context, 2020);

        assertThat(items.get(0).component()).isEqualTo("travel: national visiting per diem");
        assertThat(items.get(0).money().amount()).isEqualByComparingTo("2400");
    }
}
