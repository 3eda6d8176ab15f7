package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.application.dto.CompatibilityResult;
import io.github.riemr.schedule.application.util.ScheduleCalendarUtils;
import io.github.riemr.schedule.config.ScheduleValidationProperties;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a new schedule version (target) may be derived from an existing
 * one (current). Labels must differ and the closed date ranges must not share a day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VersionCompatibilityService {
    static final String ISSUE_OVERLAP = "Date ranges overlap with existing schedule";
    static final String ISSUE_DUPLICATE_LABEL = "Version numbers must be unique";
    static final String ISSUE_INVALID_DATES = "Invalid date format provided";
    static final String WARN_PAST_DATES = "Creating schedule for past dates";
    static final String WARN_OVERLAPPING_PERIODS = "Schedules have overlapping periods";
    static final String RECOMMEND_COMPATIBLE = "Schedules are compatible for creation";
    static final String RECOMMEND_ADJUST = "Consider adjusting date ranges or version numbers";

    private final ScheduleValidationProperties properties;

    public CompatibilityResult check(ScheduleVersion current, ScheduleVersion target) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(target, "target");

        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        LocalDate currentFrom = ScheduleCalendarUtils.parseDate(current.fromDate());
        LocalDate currentTo = ScheduleCalendarUtils.parseDate(current.toDate());
        LocalDate targetFrom = ScheduleCalendarUtils.parseDate(target.fromDate());
        LocalDate targetTo = ScheduleCalendarUtils.parseDate(target.toDate());
        boolean datesReadable = currentFrom != null && currentTo != null && targetFrom != null && targetTo != null;

        if (!datesReadable) {
            issues.add(ISSUE_INVALID_DATES);
        } else if (within(targetFrom, currentFrom, currentTo)
                || within(targetTo, currentFrom, currentTo)
                || (!targetFrom.isAfter(currentFrom) && !targetTo.isBefore(currentTo))) {
            issues.add(ISSUE_OVERLAP);
        }

        if (Objects.equals(current.version(), target.version())) {
            issues.add(ISSUE_DUPLICATE_LABEL);
        }

        if (datesReadable) {
            if (targetFrom.isBefore(currentFrom)) {
                warnings.add(WARN_PAST_DATES);
            }
            long gapDays = ScheduleCalendarUtils.gapDays(currentTo, targetFrom);
            if (gapDays > properties.getGapWarningDays()) {
                warnings.add(gapDays + " day gap between schedules");
            } else if (gapDays < 0) {
                warnings.add(WARN_OVERLAPPING_PERIODS);
            }
        }

        boolean compatible = issues.isEmpty();
        List<String> recommendations = List.of(compatible ? RECOMMEND_COMPATIBLE : RECOMMEND_ADJUST);
        log.debug("Compatibility {} -> {}: compatible={}, issues={}",
                current.version(), target.version(), compatible, issues);
        return new CompatibilityResult(compatible, issues, warnings, recommendations);
    }

    private static boolean within(LocalDate day, LocalDate from, LocalDate to) {
        return !day.isBefore(from) && !day.isAfter(to);
    }
}
