package com.forecastmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.forecastmonitor.scheduler.TaskFrequency;
import com.forecastmonitor.scheduler.TaskStatus;
import com.forecastmonitor.scheduler.TaskType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalTime;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponse {
    String taskId;
    TaskType type;
    String title;
    String description;
    TaskFrequency frequency;
    @JsonFormat(pattern = "HH:mm")
    LocalTime timeOfDay;
    Integer dayOfWeek;
    Integer dayOfMonth;
    boolean enabled;
    TaskStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant nextRun;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastRun;
}
