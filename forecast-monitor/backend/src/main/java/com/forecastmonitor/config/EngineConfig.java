package com.forecastmonitor.config;

import com.forecastmonitor.analysis.NoiseSource;
import com.forecastmonitor.analysis.RandomNoiseSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock(@Value("${scheduler.zone:UTC}") String zone) {
        log.info("Engine clock zone | zone={}", zone);
        return Clock.system(ZoneId.of(zone));
    }

    /** Seeded when {@code forecast.noise-seed} is set, so generated predictions are reproducible. */
    @Bean
    public NoiseSource noiseSource(@Value("${forecast.noise-seed:#{null}}") Long seed) {
        return seed != null ? new RandomNoiseSource(seed) : new RandomNoiseSource();
    }
}
