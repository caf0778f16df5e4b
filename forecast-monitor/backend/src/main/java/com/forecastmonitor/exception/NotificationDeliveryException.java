package com.forecastmonitor.exception;

public class NotificationDeliveryException extends ForecastMonitorException {
    public NotificationDeliveryException(String message) {
        super("NOTIFICATION_DELIVERY_FAILED", message);
    }
    public NotificationDeliveryException(String message, Throwable cause) {
        super("NOTIFICATION_DELIVERY_FAILED", message, cause);
    }
}
