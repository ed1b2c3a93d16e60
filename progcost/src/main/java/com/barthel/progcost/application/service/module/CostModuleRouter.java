package com.barthel.progcost.application.service.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.barthel.progcost.domain.exception.DataGapException;
import com.barthel.progcost.domain.exception.ReferenceDataException;
import com.barthel.progcost.domain.model.CostLineItem;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Facade routing a module configuration to the cost module that handles it.
 */
@Service
@RequiredArgsConstructor
public class CostModuleRouter {

    private final List<CostModule<?>> implementations;

    /**
     * @throws DataGapException if the module hits missing reference data
     * @throws ConfigException  if no module handles the configuration
     */
    public List<CostLineItem> compute(ModuleConfig config, CostingContext context, int year) {
        CostModule<?> module = implementations.stream()
                .filter(m -> m.supports(config.type()))
                .findFirst()
                .orElseThrow(() -> new ConfigException("No cost module for: " + config.type().id()));
        try {
            return invoke(module, config, context, year);
        } catch (ReferenceDataException e) {
            throw new DataGapException(config.type(), context.country(), e);
        }
    }

    private static <C extends ModuleConfig> List<CostLineItem> invoke(
            CostModule<C> module, ModuleConfig config, CostingContext context, int year) {
        return module.compute(module.configType().cast(config), context, year);
    }
}
