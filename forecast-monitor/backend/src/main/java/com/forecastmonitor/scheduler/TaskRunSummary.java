package com.forecastmonitor.scheduler;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a task body did. {@code coreSucceeded} tells a run whose only failures were deliveries
 * apart from one whose main computation failed.
 */
@Value
@Builder
public class TaskRunSummary {
    int forecastsProcessed;
    int alertsSent;
    int reportsGenerated;
    @Singular
    List<String> errors;
    boolean coreSucceeded;

    public ExecutionStatus status() {
        if (errors.isEmpty()) {
            return ExecutionStatus.SUCCESS;
        }
        return coreSucceeded ? ExecutionStatus.PARTIAL : ExecutionStatus.FAILED;
    }
}
