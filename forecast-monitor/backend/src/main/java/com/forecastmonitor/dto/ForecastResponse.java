package com.forecastmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.model.SeriesPoint;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ForecastResponse {
    UUID forecastId;
    String title;
    String type;
    String modelId;
    String modelName;
    Integer compatibilityScore;
    List<SeriesPoint> inputSeries;
    List<SeriesPoint> predictedSeries;
    Double accuracyScore;
    int timeHorizon;
    ForecastStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
    String requestId;
}
