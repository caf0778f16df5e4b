package com.forecastmonitor.dto;

import com.forecastmonitor.model.ForecastStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ForecastStatusRequest {
    @NotNull(message = "status is required")
    ForecastStatus status;
}
