package com.forecastmonitor.exception;

import java.util.UUID;

public class ForecastNotFoundException extends ForecastMonitorException {
    public ForecastNotFoundException(UUID id) {
        super("UNKNOWN_FORECAST", "Forecast with id '" + id + "' not found.");
    }
}
