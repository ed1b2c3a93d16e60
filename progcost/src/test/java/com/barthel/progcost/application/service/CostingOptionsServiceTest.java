package com.barthel.progcost.application.service;

import com.barthel.progcost.application.port.out.LoadReferenceDataPort;
import com.barthel.progcost.config.ProgrammeDefaults;
import com.barthel.progcost.domain.model.CostingOptions;
import com.barthel.progcost.domain.model.ProgrammeConfig;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.module.PersonnelModuleConfig;
import com.barthel.progcost.support.ReferenceDataFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CostingOptionsServiceTest {

    @Test
    void optionsComeFromReferenceDataAndDefaults() {
        LoadReferenceDataPort port = mock(LoadReferenceDataPort.class);
        when(port.loadReferenceData()).thenReturn(ReferenceDataFixtures.store());
        ProgrammeConfig defaults = new ProgrammeConfig("AAA", 2020, 2022, new BigDecimal("0.03"), "USD", 2019,
                List.of(new PersonnelModuleConfig(List.of(new PersonnelModuleConfig.Staff(1, null, null, false, null)))));
        ProgrammeDefaults programmeDefaults = mock(ProgrammeDefaults.class);
        when(programmeDefaults.get()).thenReturn(defaults);

        CostingOptions options = new CostingOptionsService(port, programmeDefaults).describeOptions();

        assertThat(options.countries()).containsExactly("AAA", "BBB", "CCC", "USA");
        assertThat(options.currencies()).startsWith("USD", "I$").doesNotContain("CCC", "USA");
        assertThat(options.modules()).containsExactly(ModuleType.values());
        assertThat(options.defaults()).isSameAs(defaults);
    }
}
