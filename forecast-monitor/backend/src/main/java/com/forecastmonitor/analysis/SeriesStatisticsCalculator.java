package com.forecastmonitor.analysis;

import com.forecastmonitor.exception.InsufficientDataException;
import com.forecastmonitor.model.TimeSeries;

/**
 * Pure functions over a {@link TimeSeries}.
 *
 * <p>Ratios with a zero baseline follow one policy: volatility of a zero-mean series with spread
 * is {@link Double#POSITIVE_INFINITY} (and {@code 0} without spread), trend against a zero
 * first-half mean is {@code 0}.
 */
public final class SeriesStatisticsCalculator {

    private SeriesStatisticsCalculator() {
    }

    public static SeriesStatistics compute(TimeSeries series) {
        if (series.isEmpty()) {
            throw new InsufficientDataException(0, 1);
        }
        double[] values = series.values();
        int n = values.length;

        double mean = mean(values, 0, n);
        double stdDev = stdDev(values, mean);
        double trendPct = trendStrengthPct(values);

        return SeriesStatistics.builder()
            .size(n)
            .mean(mean)
            .stdDev(stdDev)
            .volatilityPct(volatilityPct(mean, stdDev))
            .trendStrengthPct(trendPct)
            .trendPerPeriod(n < 2 ? 0.0 : (trendPct / 100.0) / halfCentreDistance(n))
            .build();
    }

    static double volatilityPct(double mean, double stdDev) {
        if (stdDev == 0.0) {
            return 0.0;
        }
        if (mean == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return stdDev / Math.abs(mean) * 100.0;
    }

    static double trendStrengthPct(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double firstMean = mean(values, 0, n / 2);
        double secondMean = mean(values, (n + 1) / 2, n);
        if (firstMean == 0.0) {
            return 0.0;
        }
        return (secondMean - firstMean) / firstMean * 100.0;
    }

    // Steps between the centre of the first half and the centre of the second half.
    static double halfCentreDistance(int n) {
        int firstLength = n / 2;
        int secondStart = (n + 1) / 2;
        double firstCentre = (firstLength - 1) / 2.0;
        double secondCentre = secondStart + (n - secondStart - 1) / 2.0;
        return secondCentre - firstCentre;
    }

    private static double stdDev(double[] values, double mean) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double squared = 0.0;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            squared += (v - mean) * (v - mean);
        }
        if (min == max) {
            return 0.0;
        }
        return Math.sqrt(squared / values.length);
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
