package com.forecastmonitor.entity;

import com.forecastmonitor.model.ForecastRef;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.model.TimeSeries;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "forecasts",
    indexes = {
        @Index(name = "idx_forecast_status",  columnList = "status"),
        @Index(name = "idx_forecast_model",   columnList = "model_id"),
        @Index(name = "idx_forecast_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 50)
    private String type;

    @Column(name = "model_id", nullable = false, length = 64)
    private String modelId;

    @Column(name = "model_name", nullable = false, length = 100)
    private String modelName;

    @Convert(converter = SeriesJsonConverter.class)
    @Column(name = "input_series", nullable = false, columnDefinition = "text")
    private TimeSeries inputSeries;

    @Convert(converter = SeriesJsonConverter.class)
    @Column(name = "predicted_series", nullable = false, columnDefinition = "text")
    private TimeSeries predictedSeries;

    @Column(name = "accuracy_score")
    private Double accuracyScore;

    @Column(name = "time_horizon", nullable = false)
    private int timeHorizon;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ForecastStatus status;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public ForecastRef toRef() {
        return new ForecastRef(id, title, modelName);
    }
}
