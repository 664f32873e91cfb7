package com.securenotify.keysvc.config;

import com.securenotify.keysvc.domain.ratelimit.InMemoryRateLimiter;
import com.securenotify.keysvc.domain.ratelimit.RateLimiter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metric tagging and the rate limit store gauge.
 */
@Configuration
public class ObservabilityConfig {

    private static final int MAX_URI_TAGS = 50;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> keyServiceTags(
            @Value("${spring.application.name:key-service}") String serviceName,
            @Value("${app.rate-limit.store:redis}") String store) {
        return registry -> registry.config()
                .commonTags("service", serviceName, "ratelimit_store", store)
                // key and revocation ids in paths must not explode the uri tag
                .meterFilter(MeterFilter.maximumAllowableTags(
                        "http.server.requests", "uri", MAX_URI_TAGS, MeterFilter.deny()));
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> fallbackStoreGauge(RateLimiter rateLimiter) {
        return registry -> {
            if (rateLimiter instanceof InMemoryRateLimiter memory) {
                Gauge.builder("ratelimit_memory_keys", memory, InMemoryRateLimiter::size)
                        .description("Keys tracked by the in-memory rate limit store")
                        .register(registry);
            }
        };
    }
}
