package com.forecastmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OutcomePriority {
    @JsonProperty("low") LOW(1),
    @JsonProperty("medium") MEDIUM(2),
    @JsonProperty("high") HIGH(3);

    private final int rank;

    OutcomePriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static OutcomePriority forDaysOverdue(long daysOverdue) {
        if (daysOverdue > 30) return HIGH;
        if (daysOverdue > 7) return MEDIUM;
        return LOW;
    }
}
