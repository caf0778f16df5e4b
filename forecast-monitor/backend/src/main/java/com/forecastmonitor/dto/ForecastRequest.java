package com.forecastmonitor.dto;

import com.forecastmonitor.model.SeriesPoint;
import jakarta.validation.constraints.*;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotBlank(message = "title is required")
    @Size(max = 200, message = "title must be at most 200 characters")
    String title;

    @Size(max = 50, message = "type must be at most 50 characters")
    String type;

    @NotBlank(message = "modelId is required")
    String modelId;

    @NotNull(message = "series is required")
    List<@NotNull(message = "series points must not be null") SeriesPoint> series;

    @Min(value = 1, message = "horizon must be >= 1")
    @Builder.Default
    int horizon = 6;
}
