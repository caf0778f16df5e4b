package com.forecastmonitor.scheduler;

import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.entity.TaskExecutionResult;

import java.util.List;

public interface TaskStore {

    /** Tasks in registration order. */
    List<ScheduledTask> loadTasks();

    void saveTasks(List<ScheduledTask> tasks);

    void appendHistory(TaskExecutionResult result);

    /** Newest first, at most the configured history limit. */
    List<TaskExecutionResult> history();
}
