package com.forecastmonitor.exception;

public class ModelNotFoundException extends ForecastMonitorException {
    public ModelNotFoundException(String modelId) {
        super("UNKNOWN_MODEL", "Model with id '" + modelId + "' is not registered.");
    }
}
