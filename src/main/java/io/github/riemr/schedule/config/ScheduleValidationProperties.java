package io.github.riemr.schedule.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Advisory thresholds of the schedule version checks ({@code schedule.validation.*}).
 * <p>
 * The blocking limits (one week minimum, one year maximum) are not configurable
 * because the error messages shown to operators name them.
 */
@Data
@ConfigurationProperties(prefix = "schedule.validation")
public class ScheduleValidationProperties {

    /** Ranges longer than this produce a performance warning. */
    private int longScheduleWarningDays = 180;

    /** Ranges with fewer working days than this produce a warning. */
    private int minWorkingDaysWarning = 5;

    /** Gaps between consecutive versions longer than this are reported. */
    private int gapWarningDays = 7;

    private int longTermDays = 90;

    private int shortTermDays = 14;
}
