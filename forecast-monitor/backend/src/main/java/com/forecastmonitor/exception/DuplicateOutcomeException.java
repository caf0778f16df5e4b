package com.forecastmonitor.exception;

import java.time.LocalDate;
import java.util.UUID;

public class DuplicateOutcomeException extends ForecastMonitorException {
    public DuplicateOutcomeException(UUID forecastId, LocalDate date) {
        super("DUPLICATE_OUTCOME",
              "An outcome for " + date + " is already recorded on forecast '" + forecastId + "'.");
    }
    public DuplicateOutcomeException(UUID forecastId, LocalDate date, Throwable cause) {
        super("DUPLICATE_OUTCOME",
              "An outcome for " + date + " is already recorded on forecast '" + forecastId + "'.",
              cause);
    }
}
