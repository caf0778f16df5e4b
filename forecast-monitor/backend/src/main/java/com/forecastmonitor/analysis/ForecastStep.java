package com.forecastmonitor.analysis;

import com.forecastmonitor.model.TimeSeries;

import java.time.LocalDate;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;

/**
 * Calendar step between consecutive forecast points.
 */
public enum ForecastStep {
    DAILY(Period.ofDays(1)),
    WEEKLY(Period.ofWeeks(1)),
    MONTHLY(Period.ofMonths(1)),
    QUARTERLY(Period.ofMonths(3)),
    YEARLY(Period.ofYears(1));

    private final Period period;

    ForecastStep(Period period) {
        this.period = period;
    }

    public Period period() {
        return period;
    }

    /** The date {@code steps} periods after {@code base}, always computed from the base to avoid day drift. */
    public static LocalDate advance(LocalDate base, Period period, int steps) {
        return base.plus(period.multipliedBy(steps));
    }

    /**
     * Infers the step from the median spacing of the series. Spacing close to a calendar unit maps to
     * that unit; any other spacing steps by the median gap in days. A single-point series has no
     * spacing and uses {@code fallback}.
     */
    public static Period infer(TimeSeries series, ForecastStep fallback) {
        if (series.size() < 2) {
            return fallback.period();
        }
        long[] gaps = new long[series.size() - 1];
        for (int i = 1; i < series.size(); i++) {
            gaps[i - 1] = ChronoUnit.DAYS.between(series.get(i - 1).date(), series.get(i).date());
        }
        Arrays.sort(gaps);
        long median = gaps[gaps.length / 2];

        if (median <= 1) return DAILY.period();
        if (median >= 6 && median <= 8) return WEEKLY.period();
        if (median >= 28 && median <= 31) return MONTHLY.period();
        if (median >= 89 && median <= 92) return QUARTERLY.period();
        if (median >= 365 && median <= 366) return YEARLY.period();
        return Period.ofDays(Math.toIntExact(median));
    }
}
