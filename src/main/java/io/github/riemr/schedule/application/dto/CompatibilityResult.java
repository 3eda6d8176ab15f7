package io.github.riemr.schedule.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CompatibilityResult(
    @JsonProperty("isCompatible") boolean compatible,
    List<String> issues,
    List<String> warnings,
    List<String> recommendations
) {
    public CompatibilityResult {
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }
}
