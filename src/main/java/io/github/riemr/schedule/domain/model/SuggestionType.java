package io.github.riemr.schedule.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestionType {
    OPTIMIZATION("optimization"),
    WARNING("warning"),
    RECOMMENDATION("recommendation");

    private final String code;

    SuggestionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
