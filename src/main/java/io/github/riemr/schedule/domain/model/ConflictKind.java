package io.github.riemr.schedule.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictKind {
    OVERLAP("overlap"),
    GAP("gap"),
    INVALID_RANGE("invalid_range");

    private final String code;

    ConflictKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
