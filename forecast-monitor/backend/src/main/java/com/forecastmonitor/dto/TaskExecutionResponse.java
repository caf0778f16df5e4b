package com.forecastmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.forecastmonitor.scheduler.ExecutionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TaskExecutionResponse {
    String taskId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant executionTime;
    ExecutionStatus status;
    int forecastsProcessed;
    int alertsSent;
    int reportsGenerated;
    List<String> errors;
}
