package io.github.riemr.schedule.application.dto;

import io.github.riemr.schedule.domain.model.ScheduleVersion;

public record CompatibilityCheckRequest(
    ScheduleVersion current,
    ScheduleVersion target
) {}
