package com.forecastmonitor.scheduler;

import com.forecastmonitor.client.NotificationSink;
import com.forecastmonitor.entity.ForecastRecord;
import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.exception.NotificationDeliveryException;
import com.forecastmonitor.model.ForecastRef;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.repository.ForecastRepository;
import com.forecastmonitor.service.OutcomeCorrelationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccuracyUpdateHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-15T09:00:00Z");

    @Mock ForecastRepository        forecastRepository;
    @Mock OutcomeCorrelationService correlationService;
    @Mock NotificationSink          notificationSink;
    @InjectMocks AccuracyUpdateHandler handler;

    private final ScheduledTask task = ScheduledTask.builder().id("daily_accuracy_update")
        .type(TaskType.ACCURACY_UPDATE).build();

    private static ForecastRecord forecast(String title) {
        return ForecastRecord.builder().id(UUID.randomUUID()).title(title)
            .modelName("Linear Regression").status(ForecastStatus.ACTIVE).build();
    }

    @Test
    void alertsOnlyForecastsBelowThreshold() {
        ForecastRecord weak = forecast("weak");
        ForecastRecord strong = forecast("strong");
        ForecastRecord untracked = forecast("untracked");
        when(forecastRepository.findByStatusOrderByCreatedAtAsc(ForecastStatus.ACTIVE))
            .thenReturn(List.of(weak, strong, untracked));
        when(correlationService.reevaluate(weak)).thenReturn(OptionalDouble.of(60.0));
        when(correlationService.reevaluate(strong)).thenReturn(OptionalDouble.of(90.0));
        when(correlationService.reevaluate(untracked)).thenReturn(OptionalDouble.empty());

        TaskRunSummary summary = handler.run(task, NOW);

        assertThat(summary.getForecastsProcessed()).isEqualTo(2);
        assertThat(summary.getAlertsSent()).isEqualTo(1);
        assertThat(summary.status()).isEqualTo(ExecutionStatus.SUCCESS);
        verify(notificationSink).sendAlert(new ForecastRef(weak.getId(), "weak", "Linear Regression"), 60.0);
        verifyNoMoreInteractions(notificationSink);
    }

    @Test
    void undeliveredAlert_makesRunPartial() {
        ForecastRecord weak = forecast("weak");
        when(forecastRepository.findByStatusOrderByCreatedAtAsc(ForecastStatus.ACTIVE)).thenReturn(List.of(weak));
        when(correlationService.reevaluate(weak)).thenReturn(OptionalDouble.of(50.0));
        doThrow(new NotificationDeliveryException("webhook down"))
            .when(notificationSink).sendAlert(any(), anyDouble());

        TaskRunSummary summary = handler.run(task, NOW);

        assertThat(summary.getForecastsProcessed()).isEqualTo(1);
        assertThat(summary.getAlertsSent()).isZero();
        assertThat(summary.getErrors()).hasSize(1);
        assertThat(summary.status()).isEqualTo(ExecutionStatus.PARTIAL);
    }

    @Test
    void everyComputationFailing_failsRun() {
        ForecastRecord broken = forecast("broken");
        when(forecastRepository.findByStatusOrderByCreatedAtAsc(ForecastStatus.ACTIVE)).thenReturn(List.of(broken));
        when(correlationService.reevaluate(broken)).thenThrow(new IllegalStateException("corrupt series"));

        TaskRunSummary summary = handler.run(task, NOW);

        assertThat(summary.getErrors()).singleElement().satisfies(e -> assertThat(e).contains("broken"));
        assertThat(summary.status()).isEqualTo(ExecutionStatus.FAILED);
        verifyNoInteractions(notificationSink);
    }

    @Test
    void noActiveForecasts_succeedsWithNothingDone() {
        when(forecastRepository.findByStatusOrderByCreatedAtAsc(ForecastStatus.ACTIVE)).thenReturn(List.of());

        TaskRunSummary summary = handler.run(task, NOW);

        assertThat(summary.getForecastsProcessed()).isZero();
        assertThat(summary.status()).isEqualTo(ExecutionStatus.SUCCESS);
    }
}
