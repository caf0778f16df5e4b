package com.forecastmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutcomeResponse {
    UUID outcomeId;
    UUID forecastId;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate outcomeDate;
    double actualValue;
    double predictedValue;
    double variance;
    double accuracyPercentage;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant recordedAt;
    Double forecastAccuracy;
}
