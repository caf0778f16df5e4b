package com.forecastmonitor.exception;

import java.time.LocalDate;
import java.util.UUID;

public class DateNotPredictedException extends ForecastMonitorException {
    public DateNotPredictedException(UUID forecastId, LocalDate date) {
        super("DATE_NOT_PREDICTED",
              "Forecast '" + forecastId + "' has no prediction for " + date
                  + ". Choose a date from the forecast period.");
    }
}
