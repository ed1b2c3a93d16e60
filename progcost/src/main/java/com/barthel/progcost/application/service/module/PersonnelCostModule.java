package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.DivisionLevel;
import com.barthel.progcost.domain.model.module.ModuleType;
import com.barthel.progcost.domain.model.module.PersonnelModuleConfig;
import com.barthel.progcost.domain.model.reference.SalaryRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Annual salaries of programme staff, one line item per staff entry.
 * <p>
 * Standardised entries state a headcount per division of a reference population
 * (see {@link DivisionLevel#standardPopulation()}); they are fitted to the country's
 * population and division count in the costed year.
 */
@Component
public class PersonnelCostModule implements CostModule<PersonnelModuleConfig> {

    @Override
    public List<CostLineItem> compute(PersonnelModuleConfig config, CostingContext context, int year) {
        List<CostLineItem> items = new ArrayList<>();
        for (PersonnelModuleConfig.Staff staff : config.staff()) {
            SalaryRecord salary = context.store().salary(context.country(), staff.cadreLevel());
            items.add(new CostLineItem(component(staff),
                    salary.annualSalaryAt().times(headcount(staff, context, year))));
        }
        return items;
    }

    static BigDecimal headcount(PersonnelModuleConfig.Staff staff, CostingContext context, int year) {
        if (!staff.standardized()) {
            return staff.headcount();
        }
        return fittedHeadcount(staff.headcount(), staff.level(), context, year);
    }

    /**
     * {@code headcount × population / (divisions × standard population of one division)}
     */
    static BigDecimal fittedHeadcount(BigDecimal headcount, DivisionLevel level, CostingContext context, int year) {
        int divisions = level == DivisionLevel.NATIONAL
                ? 1
                : context.store().administrativeDivisions(context.country()).divisions(level);
        BigDecimal standard = BigDecimal.valueOf(level.standardPopulation()).multiply(BigDecimal.valueOf(divisions));
        BigDecimal persons = context.population().resolvePersons(context.country(), year);
        return headcount.multiply(persons).divide(standard, MathContext.DECIMAL64);
    }

    private static String component(PersonnelModuleConfig.Staff staff) {
        if (staff.label() != null && !staff.label().isBlank()) {
            return "personnel: " + staff.label().trim();
        }
        return "personnel: cadre " + staff.cadreLevel();
    }

    @Override
    public Class<PersonnelModuleConfig> configType() {
        return PersonnelModuleConfig.class;
    }

    @Override
    public boolean supports(ModuleType type) {
        return type == ModuleType.PERSONNEL;
    }
}
