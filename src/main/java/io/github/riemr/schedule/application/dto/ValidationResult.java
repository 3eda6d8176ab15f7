package io.github.riemr.schedule.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationResult(
    @JsonProperty("isValid") boolean valid,
    List<String> errors,
    List<String> warnings,
    DateRangeMetadata metadata
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        if (!errors.isEmpty() && valid) {
            throw new IllegalArgumentException("a result with errors cannot be valid");
        }
    }

    public static ValidationResult rejected(String error) {
        return new ValidationResult(false, List.of(error), List.of(), DateRangeMetadata.EMPTY);
    }
}
