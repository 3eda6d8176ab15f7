package io.github.riemr.schedule.application.util;

import io.github.riemr.schedule.application.dto.DateRangeMetadata;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleCalendarUtilsTest {

    @Test
    void parseDate_acceptsIsoDateAndDateTime() {
        assertThat(ScheduleCalendarUtils.parseDate("2024-01-15")).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(ScheduleCalendarUtils.parseDate(" 2024-01-15 ")).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(ScheduleCalendarUtils.parseDate("2024-01-15T23:30:00Z")).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(ScheduleCalendarUtils.parseDate("2024-01-15T08:00:00")).isEqualTo(LocalDate.of(2024, 1, 15));
    }

    @Test
    void parseDate_returnsNull_forBlankOrMalformed() {
        assertThat(ScheduleCalendarUtils.parseDate(null)).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("  ")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("2024-13-01")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("2024-02-30")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("15.01.2024")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("2024-01-15Tnoon")).isNull();
    }

    @Test
    void weekCount_usesMondayStartWeeks() {
        // Monday .. Sunday
        assertThat(ScheduleCalendarUtils.weekCount(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7))).isEqualTo(1);
        // Sunday .. Monday crosses a week boundary
        assertThat(ScheduleCalendarUtils.weekCount(LocalDate.of(2024, 1, 7), LocalDate.of(2024, 1, 8))).isEqualTo(2);
        // Thursday 1 Feb .. Thursday 29 Feb
        assertThat(ScheduleCalendarUtils.weekCount(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29))).isEqualTo(5);
    }

    @Test
    void gapDays_countsDaysStrictlyBetween() {
        LocalDate end = LocalDate.of(2024, 1, 10);
        assertThat(ScheduleCalendarUtils.gapDays(end, LocalDate.of(2024, 1, 11))).isZero();
        assertThat(ScheduleCalendarUtils.gapDays(end, LocalDate.of(2024, 1, 20))).isEqualTo(9);
        assertThat(ScheduleCalendarUtils.gapDays(end, end)).isEqualTo(-1);
        assertThat(ScheduleCalendarUtils.gapDays(end, LocalDate.of(2024, 1, 5))).isEqualTo(-6);
    }

    @Test
    void describe_splitsWorkingAndWeekendDays() {
        DateRangeMetadata m = ScheduleCalendarUtils.describe(LocalDate.of(2024, 2, 5), LocalDate.of(2024, 2, 11));
        assertThat(m).isEqualTo(new DateRangeMetadata(7, 1, 5, 2));
    }

    @Test
    void describe_rejectsReversedRange() {
        assertThatThrownBy(() -> ScheduleCalendarUtils.describe(LocalDate.of(2024, 2, 11), LocalDate.of(2024, 2, 5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseDate_returnsNull_outsideFourDigitYears() {
        assertThat(ScheduleCalendarUtils.parseDate("0001-01-01")).isEqualTo(LocalDate.of(1, 1, 1));
        assertThat(ScheduleCalendarUtils.parseDate("9999-12-31")).isEqualTo(LocalDate.of(9999, 12, 31));
        assertThat(ScheduleCalendarUtils.parseDate("0000-12-31")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("+10000-01-01T00:00:00")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("-999999999-01-01T00:00:00")).isNull();
        assertThat(ScheduleCalendarUtils.parseDate("+999999999-12-31T00:00:00")).isNull();
    }

    @Test
    void weekendDays_matchesDayByDayCount() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        for (int offset = 0; offset < 7; offset++) {
            LocalDate from = start.plusDays(offset);
            for (int length = 1; length <= 30; length++) {
                LocalDate to = from.plusDays(length - 1);
                int expected = 0;
                for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
                    if (ScheduleCalendarUtils.isWeekend(d)) expected++;
                }
                assertThat(ScheduleCalendarUtils.weekendDays(from, to)).as("%s..%s", from, to).isEqualTo(expected);
            }
        }
    }
}
