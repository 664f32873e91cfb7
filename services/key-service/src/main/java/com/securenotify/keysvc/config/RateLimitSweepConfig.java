package com.securenotify.keysvc.config;

import com.securenotify.keysvc.domain.ratelimit.RateLimitService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;

/**
 * Schedules the stale-window sweep at {@code app.rate-limit.cleanup-interval-ms},
 * clamped to 1 minute .. 1 hour.
 */
@Configuration
@Slf4j
public class RateLimitSweepConfig implements SchedulingConfigurer {

    public static final int MIN_INTERVAL_MS = 60_000;
    public static final int MAX_INTERVAL_MS = 3_600_000;
    public static final int DEFAULT_INTERVAL_MS = 300_000;

    private final RateLimitService rateLimitService;
    private final Duration interval;

    public RateLimitSweepConfig(RateLimitService rateLimitService,
                                @Value("${app.rate-limit.cleanup-interval-ms:300000}") int intervalMs) {
        this.rateLimitService = rateLimitService;
        this.interval = sweepInterval(intervalMs);
    }

    static Duration sweepInterval(int configuredMs) {
        return Duration.ofMillis(SettingsBounds.bounded("app.rate-limit.cleanup-interval-ms",
                configuredMs, DEFAULT_INTERVAL_MS, MIN_INTERVAL_MS, MAX_INTERVAL_MS));
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        log.debug("Rate limit sweep every {}", interval);
        taskRegistrar.addFixedDelayTask(new FixedDelayTask(rateLimitService::sweepStaleWindows, interval, interval));
    }

    public Duration getInterval() {
        return interval;
    }
}
