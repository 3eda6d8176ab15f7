package io.github.riemr.schedule.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Used for both conflict severity and suggestion priority. */
public enum Severity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
