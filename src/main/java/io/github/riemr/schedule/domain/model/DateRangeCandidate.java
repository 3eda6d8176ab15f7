package io.github.riemr.schedule.domain.model;

import java.time.LocalDate;

/**
 * Date range picked by an operator before a schedule version is created.
 * Either bound may be missing or malformed.
 */
public record DateRangeCandidate(String from, String to) {

    public static DateRangeCandidate of(LocalDate from, LocalDate to) {
        return new DateRangeCandidate(
            from == null ? null : from.toString(),
            to == null ? null : to.toString());
    }

    public boolean isComplete() {
        return from != null && !from.isBlank() && to != null && !to.isBlank();
    }
}
