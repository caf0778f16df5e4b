package com.forecastmonitor.service;

import com.forecastmonitor.dto.ReportPayload;
import com.forecastmonitor.entity.ForecastRecord;
import com.forecastmonitor.entity.OutcomeRecord;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.repository.ForecastRepository;
import com.forecastmonitor.repository.OutcomeRepository;
import com.forecastmonitor.scheduler.TaskType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Aggregates cross-forecast metrics for the reporting tasks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    static final double EXCELLENT_THRESHOLD = 85.0;
    static final double GOOD_THRESHOLD = 75.0;

    private final ForecastRepository forecastRepository;
    private final OutcomeRepository  outcomeRepository;
    private final Clock              clock;

    @Transactional(readOnly = true)
    public ReportPayload buildReport(TaskType type, Instant now) {
        Instant periodStart = periodStart(type, now);
        List<ForecastRecord> forecasts = forecastRepository.findAll();
        List<OutcomeRecord> outcomes = outcomeRepository.findAll();

        Map<UUID, List<OutcomeRecord>> byForecast = outcomes.stream()
            .collect(Collectors.groupingBy(OutcomeRecord::getForecastId));

        // Mean accuracy over all outcomes of each forecast that has any.
        Map<UUID, Double> perForecast = new HashMap<>();
        for (ForecastRecord forecast : forecasts) {
            OptionalDouble mean = byForecast.getOrDefault(forecast.getId(), List.of()).stream()
                .mapToDouble(OutcomeRecord::getAccuracyPercentage)
                .average();
            mean.ifPresent(m -> perForecast.put(forecast.getId(), m));
        }

        double average = perForecast.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        int inPeriod = (int) outcomes.stream().filter(o -> !o.getRecordedAt().isBefore(periodStart)).count();
        int active = (int) forecasts.stream().filter(f -> f.getStatus() == ForecastStatus.ACTIVE).count();

        Map<String, Double> modelAccuracy = type == TaskType.MODEL_EVALUATION
            ? modelAccuracy(forecasts, perForecast)
            : Map.of();

        ReportPayload payload = ReportPayload.builder()
            .reportType(type)
            .title(title(type, now))
            .periodStart(periodStart)
            .generatedAt(now)
            .totalForecasts(forecasts.size())
            .activeForecasts(active)
            .forecastsWithData(perForecast.size())
            .outcomesRecorded(inPeriod)
            .averageAccuracy(round(average))
            .performanceBand(performanceBand(average))
            .modelAccuracy(modelAccuracy)
            .recommendations(recommendations(modelAccuracy))
            .build();
        log.info("Report built | type={} | forecasts={} | withData={} | outcomes={} | avgAccuracy={}",
                 type, forecasts.size(), perForecast.size(), inPeriod, payload.getAverageAccuracy());
        return payload;
    }

    Instant periodStart(TaskType type, Instant now) {
        return switch (type) {
            case WEEKLY_SUMMARY -> now.minus(Duration.ofDays(7));
            case MODEL_EVALUATION -> now.minus(Duration.ofDays(30));
            default -> LocalDate.ofInstant(now, clock.getZone()).atStartOfDay(clock.getZone()).toInstant();
        };
    }

    static String performanceBand(double averageAccuracy) {
        if (averageAccuracy >= EXCELLENT_THRESHOLD) return "excellent";
        if (averageAccuracy >= GOOD_THRESHOLD) return "good";
        return "needs_attention";
    }

    private Map<String, Double> modelAccuracy(List<ForecastRecord> forecasts, Map<UUID, Double> perForecast) {
        return forecasts.stream()
            .filter(f -> perForecast.containsKey(f.getId()))
            .collect(Collectors.groupingBy(ForecastRecord::getModelName, TreeMap::new,
                Collectors.collectingAndThen(
                    Collectors.averagingDouble(f -> perForecast.get(f.getId())),
                    ReportService::round)));
    }

    private static List<String> recommendations(Map<String, Double> modelAccuracy) {
        List<String> result = new ArrayList<>();
        result.add("Continue monitoring forecast accuracy");
        modelAccuracy.forEach((model, accuracy) -> {
            if (accuracy < GOOD_THRESHOLD) {
                result.add("Review " + model + ": average accuracy " + accuracy + "% is below " + GOOD_THRESHOLD + "%");
            }
        });
        if (modelAccuracy.isEmpty()) {
            result.add("Review models with accuracy below " + GOOD_THRESHOLD + "%");
        }
        result.add("Consider updating models with new data");
        return result;
    }

    private String title(TaskType type, Instant now) {
        LocalDate day = LocalDate.ofInstant(now, clock.getZone());
        return switch (type) {
            case WEEKLY_SUMMARY -> "Weekly Summary Report - week ending " + day;
            case MODEL_EVALUATION -> "Monthly Model Evaluation - " + day.getMonth() + " " + day.getYear();
            default -> "Daily Performance Report - " + day;
        };
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
