package com.forecastmonitor.dto;

import com.forecastmonitor.model.SeriesPoint;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ModelRankingRequest {
    @NotNull(message = "series is required")
    List<@NotNull SeriesPoint> series;
    String type;
}
