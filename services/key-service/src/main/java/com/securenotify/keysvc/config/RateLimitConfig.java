package com.securenotify.keysvc.config;

import com.securenotify.keysvc.domain.ratelimit.InMemoryRateLimiter;
import com.securenotify.keysvc.domain.ratelimit.RateLimiter;
import com.securenotify.keysvc.domain.ratelimit.RedisRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.Locale;

/**
 * Picks the admission store once at start-up. Redis is the default; the in-memory store
 * only bounds a single instance.
 */
@Configuration
@Slf4j
public class RateLimitConfig {

    @Bean
    public RateLimiter rateLimiter(
            @Value("${app.rate-limit.store:redis}") String store,
            @Value("${app.rate-limit.memory.max-entries:10000}") int maxEntries,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            Clock clock) {
        String selected = store == null ? "redis" : store.trim().toLowerCase(Locale.ROOT);
        switch (selected) {
            case "memory" -> {
                log.warn("Rate limiting uses the in-memory store; limits apply per instance only");
                return new InMemoryRateLimiter(clock, SettingsBounds.bounded("app.rate-limit.memory.max-entries",
                        maxEntries, InMemoryRateLimiter.DEFAULT_MAX_ENTRIES, 100, 1_000_000));
            }
            case "redis" -> {
                return new RedisRateLimiter(redisTemplate.getObject(), clock);
            }
            default -> throw new IllegalStateException("Unknown app.rate-limit.store: " + store);
        }
    }
}
