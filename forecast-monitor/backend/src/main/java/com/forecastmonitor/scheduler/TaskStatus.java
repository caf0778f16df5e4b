package com.forecastmonitor.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code ACTIVE -> RUNNING -> ACTIVE | ERROR}, and {@code ACTIVE <-> PAUSED} through enable/disable.
 */
public enum TaskStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("paused") PAUSED,
    @JsonProperty("running") RUNNING,
    @JsonProperty("error") ERROR
}
