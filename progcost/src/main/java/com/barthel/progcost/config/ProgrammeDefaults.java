package com.barthel.progcost.config;

import com.barthel.progcost.domain.model.ProgrammeConfig;
import com.barthel.progcost.domain.model.module.ModuleConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Default programme configuration: scalar values from {@link ProgcostProperties},
 * module set from the JSON template they point to.
 */
@Slf4j
@Component
public class ProgrammeDefaults {

    private final ProgrammeConfig defaults;

    public ProgrammeDefaults(ProgcostProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        ProgcostProperties.Defaults values = properties.defaults();
        List<ModuleConfig> modules = readModules(resourceLoader.getResource(values.modulesTemplate()), objectMapper);
        this.defaults = new ProgrammeConfig(
                values.country(),
                values.startYear(),
                values.endYear(),
                values.discountRate(),
                values.desiredCurrency(),
                values.desiredYear(),
                modules);
        log.info("Loaded default programme with {} modules from {}", modules.size(), values.modulesTemplate());
    }

    public ProgrammeConfig get() {
        return defaults;
    }

    private static List<ModuleConfig> readModules(Resource template, ObjectMapper objectMapper) {
        try (InputStream in = template.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<ModuleConfig>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read module template " + template.getDescription(), e);
        }
    }
}
