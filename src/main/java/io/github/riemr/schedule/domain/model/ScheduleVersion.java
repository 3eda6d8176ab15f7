package io.github.riemr.schedule.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named, time-bounded planning period for shift assignments.
 * <p>
 * Dates are kept as the ISO-8601 strings received from the version store so that a
 * malformed record can still be inspected and reported instead of being rejected on
 * the way in.
 */
public record ScheduleVersion(
    Long id,
    String version,
    @JsonProperty("from_date") String fromDate,
    @JsonProperty("to_date") String toDate,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt,
    @JsonProperty("is_active") boolean active,
    ScheduleVersionMeta meta
) {
    public static ScheduleVersion of(Long id, String version, String fromDate, String toDate, boolean active) {
        return new ScheduleVersion(id, version, fromDate, toDate, null, null, active, null);
    }

    public record ScheduleVersionMeta(
        String version,
        @JsonProperty("created_by") String createdBy,
        String notes
    ) {}
}
