package com.forecastmonitor.analysis;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

public class RandomNoiseSource implements NoiseSource {

    private final Random seeded;

    public RandomNoiseSource() {
        this.seeded = null;
    }

    public RandomNoiseSource(long seed) {
        this.seeded = new Random(seed);
    }

    @Override
    public double next() {
        return seeded != null ? seeded.nextDouble() : ThreadLocalRandom.current().nextDouble();
    }
}
