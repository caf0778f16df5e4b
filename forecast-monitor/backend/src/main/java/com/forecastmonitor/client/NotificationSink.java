package com.forecastmonitor.client;

import com.forecastmonitor.dto.ReportPayload;
import com.forecastmonitor.model.ForecastRef;

import java.util.List;

/**
 * Outbound channel for accuracy alerts and periodic reports.
 *
 * <p>Implementations throw {@link com.forecastmonitor.exception.NotificationDeliveryException}
 * when a message could not be delivered.
 */
public interface NotificationSink {

    void sendAlert(ForecastRef forecast, double accuracy);

    void sendReport(ReportPayload payload, List<String> recipients);
}
