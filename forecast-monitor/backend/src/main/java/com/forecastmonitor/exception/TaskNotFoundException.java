package com.forecastmonitor.exception;

public class TaskNotFoundException extends ForecastMonitorException {
    public TaskNotFoundException(String taskId) {
        super("UNKNOWN_TASK", "Scheduled task '" + taskId + "' not found.");
    }
}
