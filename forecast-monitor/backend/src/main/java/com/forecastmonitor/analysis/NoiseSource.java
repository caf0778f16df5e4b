package com.forecastmonitor.analysis;

/**
 * Source of uniform samples in {@code [0, 1)} used to perturb generated predictions.
 */
@FunctionalInterface
public interface NoiseSource {

    double next();

    static NoiseSource constant(double value) {
        return () -> value;
    }
}
