package com.forecastmonitor.scheduler;

import com.forecastmonitor.exception.InvalidRequestException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;

/**
 * Next execution instant of a recurring task, always strictly after {@code now}.
 *
 * <p>Day of week uses 0 = Sunday .. 6 = Saturday. A day of month past the end of a month runs on
 * that month's last day.
 */
public final class NextRunCalculator {

    static final int DEFAULT_DAY_OF_WEEK = 1;
    static final int DEFAULT_DAY_OF_MONTH = 1;

    private NextRunCalculator() {
    }

    public static Instant computeNextRun(TaskFrequency frequency, LocalTime timeOfDay,
                                         Integer dayOfWeek, Integer dayOfMonth, ZonedDateTime now) {
        if (timeOfDay == null) {
            throw new InvalidRequestException("timeOfDay is required");
        }
        LocalDate today = now.toLocalDate();
        return switch (frequency) {
            case DAILY -> {
                ZonedDateTime candidate = at(today, timeOfDay, now);
                yield (candidate.isAfter(now) ? candidate : at(today.plusDays(1), timeOfDay, now)).toInstant();
            }
            case WEEKLY -> {
                int target = dayOfWeek == null ? DEFAULT_DAY_OF_WEEK : dayOfWeek;
                if (target < 0 || target > 6) {
                    throw new InvalidRequestException("dayOfWeek must be between 0 (Sunday) and 6, was " + target);
                }
                int current = now.getDayOfWeek().getValue() % 7;
                int daysUntil = (target - current + 7) % 7;
                ZonedDateTime candidate = at(today.plusDays(daysUntil), timeOfDay, now);
                if (!candidate.isAfter(now)) {
                    candidate = at(today.plusDays(daysUntil + 7L), timeOfDay, now);
                }
                yield candidate.toInstant();
            }
            case MONTHLY -> {
                int target = dayOfMonth == null ? DEFAULT_DAY_OF_MONTH : dayOfMonth;
                if (target < 1 || target > 31) {
                    throw new InvalidRequestException("dayOfMonth must be between 1 and 31, was " + target);
                }
                YearMonth month = YearMonth.from(today);
                ZonedDateTime candidate = at(clamp(month, target), timeOfDay, now);
                if (!candidate.isAfter(now)) {
                    candidate = at(clamp(month.plusMonths(1), target), timeOfDay, now);
                }
                yield candidate.toInstant();
            }
        };
    }

    private static LocalDate clamp(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    private static ZonedDateTime at(LocalDate date, LocalTime time, ZonedDateTime now) {
        return ZonedDateTime.of(date, time, now.getZone());
    }
}
