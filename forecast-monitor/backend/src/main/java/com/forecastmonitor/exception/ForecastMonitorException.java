package com.forecastmonitor.exception;

import lombok.Getter;

@Getter
public abstract class ForecastMonitorException extends RuntimeException {
    private final String errorCode;
    protected ForecastMonitorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ForecastMonitorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
