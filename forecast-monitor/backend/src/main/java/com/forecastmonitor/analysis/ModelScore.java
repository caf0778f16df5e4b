package com.forecastmonitor.analysis;

import com.forecastmonitor.model.ModelDescriptor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelScore {
    ModelDescriptor model;
    int score;
    boolean recommended;
}
