package com.forecastmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AccuracyTrend {
    @JsonProperty("improving") IMPROVING,
    @JsonProperty("declining") DECLINING,
    @JsonProperty("stable") STABLE
}
