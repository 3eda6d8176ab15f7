package io.github.riemr.schedule.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a batch audit over schedule versions. The resolution at index i addresses
 * the conflict at index i.
 */
public record ConflictReport(
    List<ScheduleConflict> conflicts,
    List<ConflictResolution> resolutions
) {
    public ConflictReport {
        conflicts = List.copyOf(conflicts);
        resolutions = List.copyOf(resolutions);
    }

    @JsonProperty("hasConflicts")
    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public static ConflictReport empty() {
        return new ConflictReport(List.of(), List.of());
    }
}
