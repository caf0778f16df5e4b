package com.forecastmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ModelCategory {
    @JsonProperty("statistical") STATISTICAL,
    @JsonProperty("machine_learning") MACHINE_LEARNING,
    @JsonProperty("ai_powered") AI_POWERED
}
