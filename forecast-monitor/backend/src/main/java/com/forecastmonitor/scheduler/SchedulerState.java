package com.forecastmonitor.scheduler;

import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.entity.TaskExecutionResult;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Task list and bounded execution history, passed explicitly into each tick.
 *
 * <p>Callers mutating tasks synchronize on this object.
 */
public class SchedulerState {

    private final List<ScheduledTask> tasks;
    private final Deque<TaskExecutionResult> history;
    private final int historyLimit;

    public SchedulerState(List<ScheduledTask> tasks, List<TaskExecutionResult> newestFirst, int historyLimit) {
        this.tasks = new ArrayList<>(tasks);
        this.history = new ArrayDeque<>();
        this.historyLimit = historyLimit;
        newestFirst.stream().limit(historyLimit).forEach(this.history::addLast);
    }

    public synchronized List<ScheduledTask> tasks() {
        return List.copyOf(tasks);
    }

    public synchronized void addTask(ScheduledTask task) {
        tasks.add(task);
    }

    public synchronized Optional<ScheduledTask> findTask(String id) {
        return tasks.stream().filter(t -> t.getId().equals(id)).findFirst();
    }

    /** Due tasks in registration order. */
    public synchronized List<ScheduledTask> dueTasks(Instant now) {
        return tasks.stream().filter(t -> t.isDue(now)).toList();
    }

    public synchronized void record(TaskExecutionResult result) {
        history.addFirst(result);
        while (history.size() > historyLimit) {
            history.removeLast();
        }
    }

    public synchronized List<TaskExecutionResult> history() {
        return List.copyOf(history);
    }
}
