package io.github.riemr.schedule.application.dto;

public record ConflictResolution(
    String action,
    String description,
    String impact
) {}
