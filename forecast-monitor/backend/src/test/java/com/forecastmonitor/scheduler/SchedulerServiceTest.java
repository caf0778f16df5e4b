package com.forecastmonitor.scheduler;

import com.forecastmonitor.dto.TaskResponse;
import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.entity.TaskConfig;
import com.forecastmonitor.exception.TaskNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulerServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-15T10:00:00Z");

    @Mock TaskStore store;

    private TaskRunner runner;
    private SchedulerService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        runner = new TaskRunner(List.of(), clock);
        runner.init();
        service = new SchedulerService(store, runner, clock);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void emptyStore_isSeededWithDefaultCatalog() {
        when(store.loadTasks()).thenReturn(List.of());
        when(store.history()).thenReturn(List.of());

        service.init();

        assertThat(service.tasks()).extracting(TaskResponse::getTaskId).containsExactly(
            "daily_accuracy_update", "daily_performance_report", "weekly_summary", "model_evaluation");
        assertThat(service.tasks()).extracting(TaskResponse::getNextRun).containsExactly(
            Instant.parse("2024-05-16T09:00:00Z"),
            Instant.parse("2024-05-16T10:00:00Z"),
            Instant.parse("2024-05-20T08:00:00Z"),
            Instant.parse("2024-06-01T07:00:00Z"));
        verify(store).saveTasks(argThat(tasks -> tasks.size() == 4));
    }

    @Test
    void taskLeftRunning_isResetOnStartup() {
        ScheduledTask stuck = ScheduledTask.builder().id("daily_accuracy_update").type(TaskType.ACCURACY_UPDATE)
            .title("Daily Accuracy Update").frequency(TaskFrequency.DAILY)
            .config(TaskConfig.builder().timeOfDay(LocalTime.of(9, 0)).enabled(true).build())
            .nextRun(NOW).status(TaskStatus.RUNNING).build();
        when(store.loadTasks()).thenReturn(List.of(stuck));
        when(store.history()).thenReturn(List.of());

        service.init();

        assertThat(stuck.getStatus()).isEqualTo(TaskStatus.ACTIVE);
        assertThat(service.tasks()).hasSize(1);
    }

    @Test
    void disableThenEnable_pausesAndReschedules() {
        when(store.loadTasks()).thenReturn(List.of());
        when(store.history()).thenReturn(List.of());
        service.init();

        TaskResponse disabled = service.disable("weekly_summary");
        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.getStatus()).isEqualTo(TaskStatus.PAUSED);

        TaskResponse enabled = service.enable("weekly_summary");
        assertThat(enabled.isEnabled()).isTrue();
        assertThat(enabled.getStatus()).isEqualTo(TaskStatus.ACTIVE);
        assertThat(enabled.getNextRun()).isEqualTo(Instant.parse("2024-05-20T08:00:00Z"));
        verify(store, times(2)).saveTasks(argThat(tasks -> tasks.size() == 1));
    }

    @Test
    void unknownTask_throwsNotFound() {
        when(store.loadTasks()).thenReturn(List.of());
        when(store.history()).thenReturn(List.of());
        service.init();

        assertThatThrownBy(() -> service.runNow("nightly_backup"))
            .isInstanceOf(TaskNotFoundException.class);
    }
}
