package io.github.riemr.schedule.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportFormat {
    STANDARD("standard"),
    COMPACT("compact");

    private final String code;

    ExportFormat(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ExportFormat fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (ExportFormat value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}
