package com.forecastmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ModelComplexity {
    @JsonProperty("beginner") BEGINNER,
    @JsonProperty("intermediate") INTERMEDIATE,
    @JsonProperty("advanced") ADVANCED
}
