package com.forecastmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "outcomes",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_outcome_forecast_date", columnNames = {"forecast_id", "outcome_date"}),
    indexes = @Index(name = "idx_outcome_forecast", columnList = "forecast_id")
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutcomeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "forecast_id", nullable = false, updatable = false)
    private UUID forecastId;

    @Column(name = "outcome_date", nullable = false, updatable = false)
    private LocalDate outcomeDate;

    @Column(name = "actual_value", nullable = false, updatable = false)
    private double actualValue;

    @Column(name = "predicted_value", nullable = false, updatable = false)
    private double predictedValue;

    @Column(nullable = false, updatable = false)
    private double variance;

    @Column(name = "accuracy_percentage", nullable = false, updatable = false)
    private double accuracyPercentage;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
