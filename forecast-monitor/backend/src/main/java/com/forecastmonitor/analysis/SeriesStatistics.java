package com.forecastmonitor.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * Descriptive statistics of a series, derived fresh for every request.
 *
 * <p>{@code trendStrengthPct} compares the means of the two halves of the series;
 * {@code trendPerPeriod} is the same change expressed as a growth rate per step.
 */
@Value
@Builder
public class SeriesStatistics {
    int size;
    double mean;
    double stdDev;
    double volatilityPct;
    double trendStrengthPct;
    double trendPerPeriod;
}
