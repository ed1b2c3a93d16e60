package com.barthel.progcost.domain.model.module;

import com.barthel.progcost.domain.exception.ConfigException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A recurring meeting or workshop.
 *
 * @param label           ledger label, e.g. {@code national workshop}
 * @param level           division level hosting the meeting
 * @param days            length of each meeting in days
 * @param meetingsPerYear number of meetings per programme year
 * @param attendees       attendee groups
 * @param vehicleModel    when set, travel of attendees who need it is costed with this vehicle
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeetingModuleConfig(
        String label,
        DivisionLevel level,
        int days,
        int meetingsPerYear,
        List<Attendee> attendees,
        String vehicleModel) implements ModuleConfig {

    public MeetingModuleConfig {
        if (level == null) {
            throw new ConfigException("Meeting division level is required");
        }
        if (days <= 0 || meetingsPerYear < 0) {
            throw new ConfigException("Meetings need a positive length and a non-negative frequency");
        }
        if (attendees == null || attendees.isEmpty()) {
            throw new ConfigException("Meetings need at least one attendee group");
        }
        attendees = List.copyOf(attendees);
        if (label == null || label.isBlank()) {
            label = level.id() + " meeting";
        }
    }

    @Override
    public ModuleType type() {
        return ModuleType.MEETINGS;
    }

    /**
     * @param role        attendee group, e.g. {@code National Experts}
     * @param count       people in the group
     * @param local       local staff receive the reduced per diem
     * @param needsTravel whether the group travels to the venue
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Attendee(String role, int count, boolean local, boolean needsTravel) {
        public Attendee {
            if (role == null || role.isBlank()) {
                throw new ConfigException("Attendee role is required");
            }
            if (count < 0) {
                throw new ConfigException("Attendee count must not be negative");
            }
        }
    }
}
