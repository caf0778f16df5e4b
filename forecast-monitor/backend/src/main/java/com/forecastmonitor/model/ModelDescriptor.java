package com.forecastmonitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ModelDescriptor {
    String id;
    String name;
    ModelCategory category;
    ModelComplexity complexity;
    String description;
    @Singular
    Map<String, Object> parameters;
    String bestFor;
    ModelFamily family;

    public int intParameter(String key, int fallback) {
        Object value = parameters.get(key);
        if (value instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        return fallback;
    }
}
