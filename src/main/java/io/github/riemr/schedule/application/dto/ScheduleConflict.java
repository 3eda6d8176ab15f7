package io.github.riemr.schedule.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.riemr.schedule.domain.model.ConflictKind;
import io.github.riemr.schedule.domain.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record ScheduleConflict(
    @JsonProperty("type") ConflictKind kind,
    String message,
    List<String> affectedDates,
    Severity severity
) {
    public ScheduleConflict {
        // affected dates are raw input strings and may contain nulls
        affectedDates = Collections.unmodifiableList(new ArrayList<>(affectedDates));
    }
}
