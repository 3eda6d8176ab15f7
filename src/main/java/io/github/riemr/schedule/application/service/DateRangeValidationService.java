package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.application.dto.DateRangeMetadata;
import io.github.riemr.schedule.application.dto.ValidationResult;
import io.github.riemr.schedule.application.util.ScheduleCalendarUtils;
import io.github.riemr.schedule.config.ScheduleValidationProperties;
import io.github.riemr.schedule.domain.model.DateRangeCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a candidate planning period before a schedule version is created for it.
 * <p>
 * Missing, malformed and reversed bounds reject the candidate immediately with a single
 * error. A well-formed range is measured and then checked against every length rule,
 * so several errors may be reported together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DateRangeValidationService {
    static final String ERR_MISSING_BOUNDS = "Date range must have both start and end dates";
    static final String ERR_INVALID_FORMAT = "Invalid date format provided";
    static final String ERR_NOT_ORDERED = "Start date must be before end date";
    static final String ERR_TOO_SHORT = "Schedule must span at least one week";
    static final String ERR_TOO_LONG = "Schedule cannot span more than one year";
    static final String ERR_NO_FULL_WEEK = "Schedule must include at least one complete week";
    static final String WARN_LONG_SCHEDULE = "Long schedules may impact performance";
    static final String WARN_FEW_WORKING_DAYS = "Very few working days in selected range";

    private static final int MIN_DAYS = 7;
    private static final int MAX_DAYS = 365;

    private final ScheduleValidationProperties properties;

    public ValidationResult validate(DateRangeCandidate candidate) {
        if (candidate == null || !candidate.isComplete()) {
            return ValidationResult.rejected(ERR_MISSING_BOUNDS);
        }
        LocalDate from = ScheduleCalendarUtils.parseDate(candidate.from());
        LocalDate to = ScheduleCalendarUtils.parseDate(candidate.to());
        if (from == null || to == null) {
            return ValidationResult.rejected(ERR_INVALID_FORMAT);
        }
        // a reversed range is not measured at all
        if (!from.isBefore(to)) {
            return ValidationResult.rejected(ERR_NOT_ORDERED);
        }

        DateRangeMetadata metadata = ScheduleCalendarUtils.describe(from, to);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (metadata.totalDays() < MIN_DAYS) errors.add(ERR_TOO_SHORT);
        if (metadata.totalDays() > MAX_DAYS) errors.add(ERR_TOO_LONG);
        // unreachable once the one-week minimum holds
        if (metadata.weekCount() < 1) errors.add(ERR_NO_FULL_WEEK);

        if (metadata.totalDays() > properties.getLongScheduleWarningDays()) warnings.add(WARN_LONG_SCHEDULE);
        if (metadata.workingDays() < properties.getMinWorkingDaysWarning()) warnings.add(WARN_FEW_WORKING_DAYS);

        ValidationResult result = new ValidationResult(errors.isEmpty(), errors, warnings, metadata);
        log.debug("Validated date range {}..{}: valid={}, errors={}, warnings={}",
                from, to, result.valid(), errors.size(), warnings.size());
        return result;
    }
}
