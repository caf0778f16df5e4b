package com.forecastmonitor.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TaskFrequency {
    @JsonProperty("daily") DAILY,
    @JsonProperty("weekly") WEEKLY,
    @JsonProperty("monthly") MONTHLY
}
