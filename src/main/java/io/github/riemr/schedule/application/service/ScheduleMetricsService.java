package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.application.dto.DateRangeMetadata;
import io.github.riemr.schedule.application.dto.ScheduleMetrics;
import io.github.riemr.schedule.application.util.ScheduleCalendarUtils;
import io.github.riemr.schedule.config.ScheduleValidationProperties;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Period statistics of a stored schedule version, used by the reporting dashboards.
 * A version whose dates cannot be read, or whose end lies before its start, yields
 * {@link ScheduleMetrics#EMPTY}.
 */
@Service
@RequiredArgsConstructor
public class ScheduleMetricsService {

    private final ScheduleValidationProperties properties;

    public ScheduleMetrics compute(ScheduleVersion version) {
        if (version == null) return ScheduleMetrics.EMPTY;
        LocalDate from = ScheduleCalendarUtils.parseDate(version.fromDate());
        LocalDate to = ScheduleCalendarUtils.parseDate(version.toDate());
        if (from == null || to == null || from.isAfter(to)) {
            return ScheduleMetrics.EMPTY;
        }

        DateRangeMetadata m = ScheduleCalendarUtils.describe(from, to);
        double avgWorkingDays = Math.round(m.workingDays() * 10.0 / m.weekCount()) / 10.0;
        int weekendPercentage = (int) Math.round(m.weekendDays() * 100.0 / m.totalDays());
        return new ScheduleMetrics(
                m.totalDays(),
                m.weekCount(),
                m.workingDays(),
                m.weekendDays(),
                avgWorkingDays,
                weekendPercentage,
                m.totalDays() > properties.getLongTermDays(),
                m.totalDays() < properties.getShortTermDays());
    }
}
