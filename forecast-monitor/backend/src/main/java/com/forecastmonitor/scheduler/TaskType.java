package com.forecastmonitor.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TaskType {
    @JsonProperty("accuracy_update") ACCURACY_UPDATE,
    @JsonProperty("daily_report") DAILY_REPORT,
    @JsonProperty("weekly_summary") WEEKLY_SUMMARY,
    @JsonProperty("model_evaluation") MODEL_EVALUATION
}
