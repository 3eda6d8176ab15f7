package io.github.riemr.schedule.application.util;

import io.github.riemr.schedule.application.dto.DateRangeMetadata;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar arithmetic shared by the schedule version checks.
 * <p>
 * Weeks start on Monday. Saturday and Sunday are weekend days, every other day is a
 * working day. All ranges are closed: both bounds belong to the range.
 */
public final class ScheduleCalendarUtils {
    private ScheduleCalendarUtils() {}

    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    /**
     * Parses an ISO-8601 date ({@code 2024-01-15}) or date-time ({@code 2024-01-15T08:00:00Z}).
     * Only the calendar date of a date-time is kept. Years outside
     * {@value #MIN_YEAR}..{@value #MAX_YEAR} are treated as unreadable.
     *
     * @return the date, or {@code null} when the text is blank, not an ISO date or out of range
     */
    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) return null;
        String s = text.trim();
        LocalDate parsed;
        try {
            parsed = s.length() <= 10 ? LocalDate.parse(s) : LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(s));
        } catch (DateTimeParseException e) {
            return null;
        }
        if (parsed.getYear() < MIN_YEAR || parsed.getYear() > MAX_YEAR) return null;
        return parsed;
    }

    public static boolean isWeekend(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /** Inclusive number of days in {@code [from, to]}. */
    public static int totalDays(LocalDate from, LocalDate to) {
        return Math.toIntExact(ChronoUnit.DAYS.between(from, to)) + 1;
    }

    /** Number of Monday-start calendar weeks touched by {@code [from, to]}. */
    public static int weekCount(LocalDate from, LocalDate to) {
        LocalDate firstMonday = from.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate lastMonday = to.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return Math.toIntExact(ChronoUnit.WEEKS.between(firstMonday, lastMonday)) + 1;
    }

    /** Saturdays and Sundays in {@code [from, to]}; only the days after the last full week are enumerated. */
    public static int weekendDays(LocalDate from, LocalDate to) {
        int total = totalDays(from, to);
        // every full week holds exactly one Saturday and one Sunday
        int count = (total / 7) * 2;
        for (LocalDate d = from.plusDays(total - total % 7); !d.isAfter(to); d = d.plusDays(1)) {
            if (isWeekend(d)) count++;
        }
        return count;
    }

    /**
     * Whole days strictly between {@code end} and {@code nextStart}. Consecutive days give 0,
     * a same-day handover gives -1 and any overlap gives a negative value.
     */
    public static long gapDays(LocalDate end, LocalDate nextStart) {
        return ChronoUnit.DAYS.between(end, nextStart) - 1;
    }

    /** Day and week figures of {@code [from, to]}; {@code from} must not be after {@code to}. */
    public static DateRangeMetadata describe(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after its end " + to);
        }
        int total = totalDays(from, to);
        int weekend = weekendDays(from, to);
        return new DateRangeMetadata(total, weekCount(from, to), total - weekend, weekend);
    }
}
