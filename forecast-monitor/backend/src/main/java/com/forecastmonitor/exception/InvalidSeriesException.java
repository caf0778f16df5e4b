package com.forecastmonitor.exception;

public class InvalidSeriesException extends ForecastMonitorException {
    public InvalidSeriesException(String message) {
        super("INVALID_SERIES", message);
    }
}
