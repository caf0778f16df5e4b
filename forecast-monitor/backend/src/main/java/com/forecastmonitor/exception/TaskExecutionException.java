package com.forecastmonitor.exception;

public class TaskExecutionException extends ForecastMonitorException {
    public TaskExecutionException(String taskId, String message) {
        super("TASK_EXECUTION_FAILURE", "Task '" + taskId + "' failed: " + message);
    }
    public TaskExecutionException(String taskId, Throwable cause) {
        super("TASK_EXECUTION_FAILURE",
              "Task '" + taskId + "' failed: "
                  + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
              cause);
    }
}
