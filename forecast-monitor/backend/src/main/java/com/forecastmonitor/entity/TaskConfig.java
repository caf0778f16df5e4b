package com.forecastmonitor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.LocalTime;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskConfig {

    @Column(name = "time_of_day", nullable = false)
    private LocalTime timeOfDay;

    // 0 = Sunday .. 6 = Saturday
    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(nullable = false)
    private boolean enabled;
}
