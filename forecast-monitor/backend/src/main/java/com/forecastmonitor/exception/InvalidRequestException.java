package com.forecastmonitor.exception;

public class InvalidRequestException extends ForecastMonitorException {
    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
