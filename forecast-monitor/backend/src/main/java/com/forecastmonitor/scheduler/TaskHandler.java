package com.forecastmonitor.scheduler;

import com.forecastmonitor.entity.ScheduledTask;

import java.time.Instant;
import java.util.Set;

/**
 * Body of one or more task types. Implementations report per-item failures in the returned
 * summary and throw only when the run as a whole cannot proceed.
 */
public interface TaskHandler {

    Set<TaskType> supportedTypes();

    TaskRunSummary run(ScheduledTask task, Instant now);
}
