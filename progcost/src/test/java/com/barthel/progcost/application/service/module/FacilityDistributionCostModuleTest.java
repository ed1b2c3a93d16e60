package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.FacilityDistributionModuleConfig;
import com.barthel.progcost.domain.model.module.FacilityType;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.barthel.progcost.support.ReferenceDataFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;

class FacilityDistributionCostModuleTest {

    private final FacilityDistributionCostModule module = new FacilityDistributionCostModule();
    private final CostingContext context = CostingContext.of("AAA", ReferenceDataFixtures.store());

    @Test
    void materialIsPlacedInEverySelectedFacilityAndOffice() {
        FacilityDistributionModuleConfig config = new FacilityDistributionModuleConfig(null, "Wall poster", bd("3"),
                List.of(FacilityType.HEALTH_CENTRE, FacilityType.HEALTH_POST), true);

        List<CostLineItem> items = module.compute(config, context, 2020);

        assertThat(items).extracting(CostLineItem::component).containsExactly(
                "Wall poster: health_centre",
                "Wall poster: health_post",
                "Wall poster: administrative offices");
        // 2 per poster x 3 per site; 20 centres, 50 posts, 1 + 3 + 10 offices
        assertThat(items).extracting(item -> item.money().amount().intValue()).containsExactly(120, 300, 84);
    }

    @Test
    void officesAloneNeedNoFacilityCounts() {
        FacilityDistributionModuleConfig config = new FacilityDistributionModuleConfig("posters", "Wall poster", null,
                List.of(), true);

        List<CostLineItem> items = module.compute(config, context, 2020);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.component()).isEqualTo("posters: administrative offices");
            assertThat(item.money().amount()).isEqualByComparingTo("28");
        });
    }
}
