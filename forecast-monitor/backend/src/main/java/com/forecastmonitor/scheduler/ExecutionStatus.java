package com.forecastmonitor.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ExecutionStatus {
    @JsonProperty("success") SUCCESS,
    @JsonProperty("partial") PARTIAL,
    @JsonProperty("failed") FAILED
}
