package com.forecastmonitor.dto;

import com.forecastmonitor.model.AccuracyTrend;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class AccuracySummaryResponse {
    UUID forecastId;
    long sampleCount;
    int window;
    Double windowedAccuracy;
    Double averageAccuracy;
    Double bestAccuracy;
    Double worstAccuracy;
    Double averageVariance;
    AccuracyTrend trend;
    int trackedPeriods;
    int remainingPeriods;
}
