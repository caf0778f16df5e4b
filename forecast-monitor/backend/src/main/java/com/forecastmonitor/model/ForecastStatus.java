package com.forecastmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ForecastStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("paused") PAUSED,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("error") ERROR
}
