package com.forecastmonitor.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PendingOutcome {
    UUID forecastId;
    String forecastTitle;
    String modelName;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate predictionDate;
    double predictedValue;
    long daysOverdue;
    OutcomePriority priority;
}
