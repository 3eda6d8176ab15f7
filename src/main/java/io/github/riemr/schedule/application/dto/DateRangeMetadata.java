package io.github.riemr.schedule.application.dto;

public record DateRangeMetadata(
    int totalDays,
    int weekCount,
    int workingDays,
    int weekendDays
) {
    public static final DateRangeMetadata EMPTY = new DateRangeMetadata(0, 0, 0, 0);
}
