package io.github.riemr.schedule.application.dto;

import io.github.riemr.schedule.domain.model.DateRangeCandidate;
import io.github.riemr.schedule.domain.model.ScheduleVersion;

import java.util.List;

public record SuggestionRequest(
    String from,
    String to,
    List<ScheduleVersion> existingVersions
) {
    public DateRangeCandidate toCandidate() {
        return new DateRangeCandidate(from, to);
    }
}
