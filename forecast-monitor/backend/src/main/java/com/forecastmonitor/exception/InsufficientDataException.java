package com.forecastmonitor.exception;

public class InsufficientDataException extends ForecastMonitorException {
    public InsufficientDataException(int size, int required) {
        super("INSUFFICIENT_DATA",
              "Series has " + size + " point(s); at least " + required + " required.");
    }
}
