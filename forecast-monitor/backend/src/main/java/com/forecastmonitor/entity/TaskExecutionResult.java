package com.forecastmonitor.entity;

import com.forecastmonitor.scheduler.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
    name = "task_executions",
    indexes = {
        @Index(name = "idx_exec_time", columnList = "execution_time"),
        @Index(name = "idx_exec_task", columnList = "task_id"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskExecutionResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "task_id", nullable = false, length = 64)
    private String taskId;

    @Column(name = "execution_time", nullable = false)
    private Instant executionTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExecutionStatus status;

    @Column(name = "forecasts_processed")
    private int forecastsProcessed;

    @Column(name = "alerts_sent")
    private int alertsSent;

    @Column(name = "reports_generated")
    private int reportsGenerated;

    @Builder.Default
    @Convert(converter = StringListJsonConverter.class)
    @Column(columnDefinition = "text")
    private List<String> errors = new ArrayList<>();
}
