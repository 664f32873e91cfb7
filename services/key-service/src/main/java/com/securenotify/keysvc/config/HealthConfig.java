package com.securenotify.keysvc.config;

import com.securenotify.keysvc.domain.ratelimit.RateLimiter;
import com.securenotify.keysvc.domain.ratelimit.RedisRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Actuator indicators for the two stores revocation depends on.
 */
@Configuration
@RequiredArgsConstructor
public class HealthConfig {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final RateLimiter rateLimiter;

    @Bean
    public HealthIndicator keyStoreHealthIndicator() {
        return () -> {
            Health.Builder builder = Health.unknown().withDetail("database", "PostgreSQL");
            try (Connection conn = dataSource.getConnection()) {
                return conn.isValid(VALIDATION_TIMEOUT_SECONDS)
                        ? builder.up().build()
                        : builder.down().withDetail("error", "connection invalid").build();
            } catch (SQLException e) {
                return builder.down().withDetail("error", e.getMessage()).build();
            }
        };
    }

    /**
     * Down while the Redis circuit is open, since every admission check is then denied.
     */
    @Bean
    public HealthIndicator rateLimitStoreHealthIndicator() {
        return () -> {
            Health.Builder builder = Health.up().withDetail("store", rateLimiter.storeName());
            if (rateLimiter instanceof RedisRateLimiter redis) {
                builder.withDetail("circuit", redis.circuitState());
                if (!redis.isAvailable()) {
                    builder.down().withDetail("mode", "fail-closed");
                }
            }
            return builder.build();
        };
    }
}
