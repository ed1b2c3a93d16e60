package com.barthel.progcost;

import com.barthel.progcost.application.port.in.CostProgrammeUseCase;
import com.barthel.progcost.config.ProgrammeDefaults;
import com.barthel.progcost.domain.model.CostLedger;
import com.barthel.progcost.domain.model.CostLedgerEntry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ProgcostApplicationTests {

    @Autowired
    private CostProgrammeUseCase costProgrammeUseCase;

    @Autowired
    private ProgrammeDefaults programmeDefaults;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
        assertThat(programmeDefaults.get().country()).isEqualTo("UGA");
    }

    @Test
    void defaultProgrammeIsCostedFromSeededReferenceData() {
        CostLedger ledger = costProgrammeUseCase.costProgramme(programmeDefaults.get());

        assertThat(ledger.currency()).isEqualTo("USD");
        assertThat(ledger.priceYear()).isEqualTo(2018);
        assertThat(ledger.totalsByYear()).containsOnlyKeys(2020, 2021, 2022, 2023, 2024);
        // 3 staff, per diem and travel, 3 facility types and offices, 2 supplies
        assertThat(ledger.entries()).hasSize(5 * 11)
                .isSortedAccordingTo(CostLedgerEntry.LEDGER_ORDER)
                .allSatisfy(entry -> assertThat(entry.cost()).isPositive());
        assertThat(ledger.totalsByYear().get(2020)).isGreaterThan(ledger.totalsByYear().get(2024));
    }

    @Test
    void defaultProgrammeIsServedAsCsv() throws Exception {
        String csv = mockMvc.perform(post("/api/programme-costs").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        String[] lines = csv.split("\n");
        assertThat(lines).hasSize(1 + 5 * 11);
        assertThat(lines[0]).isEqualTo("year,component,cost,currency,price_year");
        assertThat(lines[1]).startsWith("2020,").endsWith(",USD,2018");
    }

    @Test
    void unknownCountryIsRejected() throws Exception {
        mockMvc.perform(post("/api/programme-costs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"country\": \"XYZ\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Unknown country code: XYZ"));
    }

    @Test
    void countryWithoutSalariesIsADataGap() throws Exception {
        mockMvc.perform(post("/api/programme-costs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"country\": \"VNM\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.module").value("personnel"));
    }

    @Test
    void optionsExposeSeededCountries() throws Exception {
        mockMvc.perform(get("/api/programme-costs/options"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currencies[0]").value("USD"))
                .andExpect(jsonPath("$.defaults.country").value("UGA"));
    }
}
