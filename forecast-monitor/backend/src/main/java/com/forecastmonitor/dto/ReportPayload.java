package com.forecastmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.forecastmonitor.scheduler.TaskType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ReportPayload {
    TaskType reportType;
    String title;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant periodStart;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int totalForecasts;
    int activeForecasts;
    int forecastsWithData;
    int outcomesRecorded;
    double averageAccuracy;
    String performanceBand;
    Map<String, Double> modelAccuracy;
    List<String> recommendations;
}
