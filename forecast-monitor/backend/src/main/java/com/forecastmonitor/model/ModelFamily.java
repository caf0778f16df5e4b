package com.forecastmonitor.model;

/**
 * Algorithm variant a {@link ModelDescriptor} is generated with. The registry stays purely
 * descriptive; the prediction generator dispatches on this tag.
 */
public enum ModelFamily {
    TREND,
    MOVING_AVERAGE,
    SMOOTHING,
    POLYNOMIAL,
    NEURAL,
    AUTOREGRESSIVE,
    ENSEMBLE,
    SEASONAL,
    DEFAULT
}
