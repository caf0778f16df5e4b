package com.forecastmonitor.entity;

import com.forecastmonitor.scheduler.TaskFrequency;
import com.forecastmonitor.scheduler.TaskStatus;
import com.forecastmonitor.scheduler.TaskType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "scheduled_tasks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledTask {

    @Id
    @Column(length = 64, updatable = false, nullable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskType type;

    @Column(nullable = false, length = 100)
    private String title;

    @Column(length = 255)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskFrequency frequency;

    @Embedded
    private TaskConfig config;

    @Column(name = "next_run", nullable = false)
    private Instant nextRun;

    @Column(name = "last_run")
    private Instant lastRun;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "registration_order", nullable = false)
    private int registrationOrder;

    public boolean isDue(Instant now) {
        return config.isEnabled() && status == TaskStatus.ACTIVE && !nextRun.isAfter(now);
    }
}
