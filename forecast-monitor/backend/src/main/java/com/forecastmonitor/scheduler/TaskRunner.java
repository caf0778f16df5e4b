package com.forecastmonitor.scheduler;

import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.entity.TaskExecutionResult;
import com.forecastmonitor.exception.InvalidRequestException;
import com.forecastmonitor.exception.TaskExecutionException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs due tasks of a {@link SchedulerState}, one after another, each bounded by a timeout.
 *
 * <p>A task body that throws or times out yields a {@code FAILED} result and leaves the task in
 * {@code ERROR}; the remaining due tasks still run. The next run is always computed from the
 * moment the execution finished, so missed slots are not replayed.
 *
 * <p>A timed-out body that ignores interruption keeps its task fenced until it actually returns.
 */
@Slf4j
@Component
public class TaskRunner {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final Clock clock;
    private final Map<String, Execution> inFlight = new ConcurrentHashMap<>();

    @Value("${scheduler.task-timeout-seconds:30}")
    private long taskTimeoutSeconds = 30;

    private ExecutorService executor;

    public TaskRunner(List<TaskHandler> handlers, Clock clock) {
        this.clock = clock;
        for (TaskHandler handler : handlers) {
            handler.supportedTypes().forEach(type -> this.handlers.put(type, handler));
        }
    }

    @PostConstruct
    void init() {
        executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** Executes every task due at {@code now}, in registration order. */
    public List<TaskExecutionResult> tick(SchedulerState state, Instant now) {
        List<TaskExecutionResult> results = new ArrayList<>();
        for (ScheduledTask task : state.dueTasks(now)) {
            if (isInFlight(task.getId())) {
                log.warn("Task skipped | id={} | reason=previous execution still in flight", task.getId());
                continue;
            }
            try {
                results.add(execute(state, task));
            } catch (InvalidRequestException e) {
                log.info("Task skipped | id={} | reason={}", task.getId(), e.getMessage());
            }
        }
        return results;
    }

    public TaskExecutionResult execute(SchedulerState state, ScheduledTask task) {
        Instant startedAt = clock.instant();
        synchronized (state) {
            if (task.getStatus() == TaskStatus.RUNNING) {
                throw new InvalidRequestException("Task '" + task.getId() + "' is already running.");
            }
            if (isInFlight(task.getId())) {
                throw new InvalidRequestException(
                    "Task '" + task.getId() + "' is already running: a timed-out execution has not returned yet.");
            }
            task.setStatus(TaskStatus.RUNNING);
            task.setLastRun(startedAt);
        }
        log.info("Task started | id={} | type={}", task.getId(), task.getType());

        TaskExecutionResult result;
        try {
            TaskRunSummary summary = runBody(task, startedAt);
            result = TaskExecutionResult.builder()
                .taskId(task.getId())
                .executionTime(startedAt)
                .status(summary.status())
                .forecastsProcessed(summary.getForecastsProcessed())
                .alertsSent(summary.getAlertsSent())
                .reportsGenerated(summary.getReportsGenerated())
                .errors(new ArrayList<>(summary.getErrors()))
                .build();
        } catch (TaskExecutionException ex) {
            log.error("Task failed | id={} | error={}", task.getId(), ex.getMessage(), ex);
            result = TaskExecutionResult.builder()
                .taskId(task.getId())
                .executionTime(startedAt)
                .status(ExecutionStatus.FAILED)
                .errors(new ArrayList<>(List.of(ex.getMessage())))
                .build();
        }

        synchronized (state) {
            TaskStatus next = result.getStatus() == ExecutionStatus.FAILED ? TaskStatus.ERROR : TaskStatus.ACTIVE;
            if (next == TaskStatus.ACTIVE && !task.getConfig().isEnabled()) {
                next = TaskStatus.PAUSED;
            }
            task.setStatus(next);
            task.setNextRun(nextRun(task, clock.instant()));
            state.record(result);
        }
        log.info("Task finished | id={} | status={} | processed={} | alerts={} | reports={} | errors={} | nextRun={}",
                 task.getId(), result.getStatus(), result.getForecastsProcessed(), result.getAlertsSent(),
                 result.getReportsGenerated(), result.getErrors().size(), task.getNextRun());
        return result;
    }

    /** Whether a body submitted for {@code taskId} has not returned yet, including one that timed out. */
    boolean isInFlight(String taskId) {
        Execution execution = inFlight.get(taskId);
        return execution != null && !execution.hasReturned();
    }

    public Instant nextRun(ScheduledTask task, Instant from) {
        return NextRunCalculator.computeNextRun(
            task.getFrequency(),
            task.getConfig().getTimeOfDay(),
            task.getConfig().getDayOfWeek(),
            task.getConfig().getDayOfMonth(),
            ZonedDateTime.ofInstant(from, clock.getZone()));
    }

    private TaskRunSummary runBody(ScheduledTask task, Instant startedAt) {
        TaskHandler handler = handlers.get(task.getType());
        if (handler == null) {
            throw new TaskExecutionException(task.getId(), "no handler for task type " + task.getType());
        }
        Execution execution = new Execution();
        inFlight.put(task.getId(), execution);
        Future<TaskRunSummary> future;
        try {
            future = executor.submit(() -> execution.run(() -> handler.run(task, startedAt)));
        } catch (RejectedExecutionException ex) {
            inFlight.remove(task.getId(), execution);
            throw new TaskExecutionException(task.getId(), ex);
        }
        try {
            return future.get(taskTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            execution.interrupt();
            log.warn("Task timed out | id={} | timeoutSeconds={} | stillRunning={}",
                     task.getId(), taskTimeoutSeconds, !execution.hasReturned());
            throw new TaskExecutionException(task.getId(), "timed out after " + taskTimeoutSeconds + "s");
        } catch (ExecutionException ex) {
            throw new TaskExecutionException(task.getId(), ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            execution.interrupt();
            throw new TaskExecutionException(task.getId(), ex);
        }
    }

    /** One submitted task body; it counts as returned only once the body itself exits. */
    private static final class Execution {
        private final CountDownLatch returned = new CountDownLatch(1);
        private volatile Thread worker;

        TaskRunSummary run(Callable<TaskRunSummary> body) throws Exception {
            worker = Thread.currentThread();
            try {
                return body.call();
            } finally {
                worker = null;
                returned.countDown();
            }
        }

        void interrupt() {
            Thread current = worker;
            if (current != null) {
                current.interrupt();
            }
        }

        boolean hasReturned() {
            return returned.getCount() == 0;
        }
    }
}
