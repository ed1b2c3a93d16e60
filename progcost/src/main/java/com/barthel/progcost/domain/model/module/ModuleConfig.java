package com.barthel.progcost.domain.model.module;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Parameters of one configured cost module. The JSON form carries the module
 * identifier in a {@code module} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "module")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PersonnelModuleConfig.class, name = "personnel"),
        @JsonSubTypes.Type(value = TravelModuleConfig.class, name = "travel"),
        @JsonSubTypes.Type(value = TransportModuleConfig.class, name = "transport"),
        @JsonSubTypes.Type(value = SuppliesModuleConfig.class, name = "supplies"),
        @JsonSubTypes.Type(value = FacilityDistributionModuleConfig.class, name = "facility_distribution"),
        @JsonSubTypes.Type(value = LogisticsModuleConfig.class, name = "logistics"),
        @JsonSubTypes.Type(value = MeetingModuleConfig.class, name = "meetings")
})
public interface ModuleConfig {

    /**
     * @return the module this configuration belongs to
     */
    ModuleType type();
}
