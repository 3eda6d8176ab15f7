package io.github.riemr.schedule.application.dto;

import io.github.riemr.schedule.domain.model.Severity;
import io.github.riemr.schedule.domain.model.SuggestionType;

public record ScheduleSuggestion(
    SuggestionType type,
    String message,
    Severity priority
) {}
