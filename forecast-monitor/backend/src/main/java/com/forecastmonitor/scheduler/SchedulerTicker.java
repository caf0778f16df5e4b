package com.forecastmonitor.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link SchedulerService#tick()} from a single Spring scheduling thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerTicker {

    private final SchedulerService schedulerService;

    @Scheduled(fixedDelayString = "${scheduler.poll-interval-ms:60000}",
               initialDelayString = "${scheduler.initial-delay-ms:10000}")
    public void tick() {
        try {
            int executed = schedulerService.tick().size();
            if (executed > 0) {
                log.info("Scheduler tick complete | executed={}", executed);
            }
        } catch (Exception e) {
            log.error("Scheduler tick failed | error={}", e.getMessage(), e);
        }
    }
}
