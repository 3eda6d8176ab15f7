package io.github.riemr.schedule.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScheduleMetrics(
    int totalDays,
    int weekCount,
    int workingDays,
    int weekendDays,
    double averageWorkingDaysPerWeek,
    int weekendPercentage,
    @JsonProperty("isLongTerm") boolean longTerm,
    @JsonProperty("isShortTerm") boolean shortTerm
) {
    public static final ScheduleMetrics EMPTY = new ScheduleMetrics(0, 0, 0, 0, 0.0, 0, false, false);
}
