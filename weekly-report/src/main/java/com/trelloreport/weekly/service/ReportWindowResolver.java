package com.trelloreport.weekly.service;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.exception.InvalidWindowException;
import com.trelloreport.weekly.model.WindowSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Works out the reporting window in the report timezone (America/Chicago by default).
 *
 * Explicit dates cover whole civil days: start at midnight, end at 23:59:59.999999.
 * Without dates the window is the current week, from the most recent week-start day
 * (Sunday by default, today if today is that day) for seven civil days.
 */
@Component
@RequiredArgsConstructor
public class ReportWindowResolver {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

    private final WeeklyReportProperties properties;
    private final Clock clock;

    /**
     * @param explicitStart First day of the report, or null for the current week
     * @param explicitEnd   Last day of the report, or null for the current week
     * @throws InvalidWindowException if only one date is given or start is after end
     */
    public WindowSpec resolveWindow(LocalDate explicitStart, LocalDate explicitEnd) {
        if (explicitStart == null && explicitEnd == null) {
            return currentWeek();
        }
        if (explicitStart == null || explicitEnd == null) {
            throw new InvalidWindowException("Both start and end dates are required when either is given");
        }
        if (explicitStart.isAfter(explicitEnd)) {
            throw new InvalidWindowException(
                    "Start date " + explicitStart + " must be before or equal to end date " + explicitEnd);
        }

        ZoneId zone = zone();
        return new WindowSpec(
                explicitStart.atStartOfDay(zone).toInstant(),
                explicitEnd.atTime(END_OF_DAY).atZone(zone).toInstant());
    }

    public WindowSpec currentWeek() {
        ZoneId zone = zone();
        DayOfWeek weekStart = properties.getAggregation().getWeekStart();

        LocalDate today = LocalDate.now(clock.withZone(zone));
        ZonedDateTime start = today.with(TemporalAdjusters.previousOrSame(weekStart)).atStartOfDay(zone);
        ZonedDateTime end = start.plusDays(7).minus(1, ChronoUnit.MICROS);

        return new WindowSpec(start.toInstant(), end.toInstant());
    }

    public ZoneId zone() {
        return ZoneId.of(properties.getAggregation().getTimezone());
    }
}
