package com.forecastmonitor.scheduler;

import com.forecastmonitor.client.NotificationSink;
import com.forecastmonitor.entity.ForecastRecord;
import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.exception.NotificationDeliveryException;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.repository.ForecastRepository;
import com.forecastmonitor.service.OutcomeCorrelationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Re-evaluates every active forecast and alerts those whose windowed accuracy fell below the
 * threshold.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccuracyUpdateHandler implements TaskHandler {

    private final ForecastRepository        forecastRepository;
    private final OutcomeCorrelationService correlationService;
    private final NotificationSink          notificationSink;

    @Value("${scheduler.alert-threshold:75}")
    private double alertThreshold = 75.0;

    @Override
    public Set<TaskType> supportedTypes() {
        return Set.of(TaskType.ACCURACY_UPDATE);
    }

    @Override
    public TaskRunSummary run(ScheduledTask task, Instant now) {
        TaskRunSummary.TaskRunSummaryBuilder summary = TaskRunSummary.builder();
        int processed = 0;
        int alerts = 0;
        int computeFailures = 0;

        for (ForecastRecord forecast : forecastRepository.findByStatusOrderByCreatedAtAsc(ForecastStatus.ACTIVE)) {
            OptionalDouble accuracy;
            try {
                accuracy = correlationService.reevaluate(forecast);
            } catch (RuntimeException ex) {
                computeFailures++;
                log.warn("Accuracy re-evaluation failed | forecastId={} | error={}", forecast.getId(), ex.getMessage());
                summary.error("Error processing forecast " + forecast.getTitle() + ": " + ex.getMessage());
                continue;
            }
            if (accuracy.isEmpty()) {
                continue;
            }
            processed++;
            if (accuracy.getAsDouble() < alertThreshold) {
                try {
                    notificationSink.sendAlert(forecast.toRef(), accuracy.getAsDouble());
                    alerts++;
                } catch (NotificationDeliveryException ex) {
                    log.warn("Accuracy alert not delivered | forecastId={} | error={}", forecast.getId(), ex.getMessage());
                    summary.error("Alert for forecast " + forecast.getTitle() + " not delivered: " + ex.getMessage());
                }
            }
        }

        return summary
            .forecastsProcessed(processed)
            .alertsSent(alerts)
            .coreSucceeded(processed > 0 || computeFailures == 0)
            .build();
    }
}
