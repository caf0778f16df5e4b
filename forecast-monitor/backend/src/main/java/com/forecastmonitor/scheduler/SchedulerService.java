package com.forecastmonitor.scheduler;

import com.forecastmonitor.dto.TaskExecutionResponse;
import com.forecastmonitor.dto.TaskResponse;
import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.entity.TaskConfig;
import com.forecastmonitor.entity.TaskExecutionResult;
import com.forecastmonitor.exception.TaskNotFoundException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/**
 * Owns the live {@link SchedulerState}: loads it at start-up, seeds the default task catalog on
 * an empty store, and persists every change made by ticks and by operators.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerService {

    private final TaskStore  store;
    private final TaskRunner runner;
    private final Clock      clock;

    @Value("${scheduler.history-limit:100}")
    private int historyLimit = 100;

    private SchedulerState state;

    @PostConstruct
    void init() {
        state = new SchedulerState(store.loadTasks(), store.history(), historyLimit);
        if (state.tasks().isEmpty()) {
            defaultTasks(clock.instant()).forEach(state::addTask);
            log.info("Default scheduled tasks seeded | count={}", state.tasks().size());
        }
        for (ScheduledTask task : state.tasks()) {
            // A RUNNING task at start-up was interrupted by a shutdown.
            if (task.getStatus() == TaskStatus.RUNNING) {
                task.setStatus(task.getConfig().isEnabled() ? TaskStatus.ACTIVE : TaskStatus.PAUSED);
                log.warn("Task left running by a previous shutdown was reset | id={}", task.getId());
            }
        }
        store.saveTasks(state.tasks());
    }

    public List<TaskExecutionResult> tick() {
        List<TaskExecutionResult> results = runner.tick(state, clock.instant());
        if (!results.isEmpty()) {
            persist(results);
        }
        return results;
    }

    /** Runs a task immediately with the same bookkeeping as a scheduled run. */
    public TaskExecutionResponse runNow(String taskId) {
        ScheduledTask task = find(taskId);
        TaskExecutionResult result = runner.execute(state, task);
        persist(List.of(result));
        return toResponse(result);
    }

    public TaskResponse enable(String taskId) {
        ScheduledTask task = find(taskId);
        synchronized (state) {
            task.getConfig().setEnabled(true);
            if (task.getStatus() != TaskStatus.RUNNING) {
                task.setStatus(TaskStatus.ACTIVE);
                task.setNextRun(runner.nextRun(task, clock.instant()));
            }
            store.saveTasks(List.of(task));
            log.info("Task enabled | id={} | nextRun={}", taskId, task.getNextRun());
            return toResponse(task);
        }
    }

    /** An in-flight execution is not interrupted; the task parks as PAUSED when it finishes. */
    public TaskResponse disable(String taskId) {
        ScheduledTask task = find(taskId);
        synchronized (state) {
            task.getConfig().setEnabled(false);
            if (task.getStatus() != TaskStatus.RUNNING) {
                task.setStatus(TaskStatus.PAUSED);
            }
            store.saveTasks(List.of(task));
            log.info("Task disabled | id={}", taskId);
            return toResponse(task);
        }
    }

    public List<TaskResponse> tasks() {
        synchronized (state) {
            return state.tasks().stream().map(SchedulerService::toResponse).toList();
        }
    }

    public List<TaskExecutionResponse> history(int limit) {
        return state.history().stream().limit(Math.max(0, limit)).map(SchedulerService::toResponse).toList();
    }

    SchedulerState state() {
        return state;
    }

    private void persist(List<TaskExecutionResult> results) {
        synchronized (state) {
            store.saveTasks(state.tasks());
            results.forEach(store::appendHistory);
        }
    }

    private ScheduledTask find(String taskId) {
        return state.findTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    List<ScheduledTask> defaultTasks(Instant now) {
        List<ScheduledTask> tasks = List.of(
            task("daily_accuracy_update", TaskType.ACCURACY_UPDATE, "Daily Accuracy Update",
                 "Re-evaluate forecast accuracy and send alerts for underperforming forecasts",
                 TaskFrequency.DAILY, LocalTime.of(9, 0), null, null, 0),
            task("daily_performance_report", TaskType.DAILY_REPORT, "Daily Performance Report",
                 "Daily summary of forecast performance and outcomes",
                 TaskFrequency.DAILY, LocalTime.of(10, 0), null, null, 1),
            task("weekly_summary", TaskType.WEEKLY_SUMMARY, "Weekly Summary Report",
                 "Weekly analysis with trends and recommendations",
                 TaskFrequency.WEEKLY, LocalTime.of(8, 0), 1, null, 2),
            task("model_evaluation", TaskType.MODEL_EVALUATION, "Monthly Model Evaluation",
                 "Compare model accuracy across forecasts and suggest improvements",
                 TaskFrequency.MONTHLY, LocalTime.of(7, 0), null, 1, 3));
        tasks.forEach(t -> t.setNextRun(runner.nextRun(t, now)));
        return tasks;
    }

    private static ScheduledTask task(String id, TaskType type, String title, String description,
                                      TaskFrequency frequency, LocalTime time,
                                      Integer dayOfWeek, Integer dayOfMonth, int order) {
        return ScheduledTask.builder()
            .id(id).type(type).title(title).description(description)
            .frequency(frequency)
            .config(TaskConfig.builder()
                .timeOfDay(time).dayOfWeek(dayOfWeek).dayOfMonth(dayOfMonth).enabled(true)
                .build())
            .status(TaskStatus.ACTIVE)
            .registrationOrder(order)
            .build();
    }

    private static TaskResponse toResponse(ScheduledTask t) {
        return TaskResponse.builder()
            .taskId(t.getId()).type(t.getType()).title(t.getTitle()).description(t.getDescription())
            .frequency(t.getFrequency())
            .timeOfDay(t.getConfig().getTimeOfDay())
            .dayOfWeek(t.getConfig().getDayOfWeek())
            .dayOfMonth(t.getConfig().getDayOfMonth())
            .enabled(t.getConfig().isEnabled())
            .status(t.getStatus())
            .nextRun(t.getNextRun())
            .lastRun(t.getLastRun())
            .build();
    }

    private static TaskExecutionResponse toResponse(TaskExecutionResult r) {
        return TaskExecutionResponse.builder()
            .taskId(r.getTaskId())
            .executionTime(r.getExecutionTime())
            .status(r.getStatus())
            .forecastsProcessed(r.getForecastsProcessed())
            .alertsSent(r.getAlertsSent())
            .reportsGenerated(r.getReportsGenerated())
            .errors(List.copyOf(r.getErrors()))
            .build();
    }
}
