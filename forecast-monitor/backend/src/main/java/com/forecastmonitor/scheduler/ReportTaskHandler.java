package com.forecastmonitor.scheduler;

import com.forecastmonitor.client.NotificationSink;
import com.forecastmonitor.dto.ReportPayload;
import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.exception.NotificationDeliveryException;
import com.forecastmonitor.service.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReportTaskHandler implements TaskHandler {

    private final ReportService    reportService;
    private final NotificationSink notificationSink;

    @Value("${notifications.recipients:}")
    private List<String> recipients = List.of();

    @Override
    public Set<TaskType> supportedTypes() {
        return Set.of(TaskType.DAILY_REPORT, TaskType.WEEKLY_SUMMARY, TaskType.MODEL_EVALUATION);
    }

    @Override
    public TaskRunSummary run(ScheduledTask task, Instant now) {
        ReportPayload payload = reportService.buildReport(task.getType(), now);
        TaskRunSummary.TaskRunSummaryBuilder summary = TaskRunSummary.builder()
            .forecastsProcessed(payload.getForecastsWithData())
            .reportsGenerated(1)
            .coreSucceeded(true);
        try {
            notificationSink.sendReport(payload, recipients);
        } catch (NotificationDeliveryException ex) {
            log.warn("Report not delivered | taskId={} | type={} | error={}", task.getId(), task.getType(), ex.getMessage());
            summary.error("Report delivery failed: " + ex.getMessage());
        }
        return summary.build();
    }
}
