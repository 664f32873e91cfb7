package com.securenotify.keysvc.domain.ratelimit;

import com.securenotify.keysvc.shared.exception.RateLimitedException;
import com.securenotify.keysvc.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private RateLimitService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(
                MutableClock.startingAt("2025-01-01T00:00:00Z"), InMemoryRateLimiter.DEFAULT_MAX_ENTRIES);
        service = new RateLimitService(limiter, meterRegistry, 60, 100, 10, 5, 5, 20, 5);
    }

    @Test
    @DisplayName("Enforce throws once the class limit is spent and counts the denial")
    void enforceThrowsWhenExhausted() {
        for (int i = 0; i < 5; i++) {
            service.enforce("ip:1.2.3.4", EndpointClass.CLEANUP);
        }

        assertThatThrownBy(() -> service.enforce("ip:1.2.3.4", EndpointClass.CLEANUP))
                .isInstanceOf(RateLimitedException.class)
                .satisfies(e -> assertThat(((RateLimitedException) e).getRetryAfterSeconds()).isBetween(1L, 60L));
        assertThat(meterRegistry.counter("ratelimit_denied_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Endpoint classes keep separate budgets for the same caller")
    void classesAreSeparate() {
        for (int i = 0; i < 5; i++) {
            service.check("ip:1.2.3.4", EndpointClass.REGISTER);
        }

        assertThat(service.check("ip:1.2.3.4", EndpointClass.REGISTER).allowed()).isFalse();
        assertThat(service.check("ip:1.2.3.4", EndpointClass.SUBSCRIBE).allowed()).isTrue();
    }

    @Test
    @DisplayName("Out-of-range settings are clamped")
    void settingsAreClamped() {
        RateLimitService clamped = new RateLimitService(
                new InMemoryRateLimiter(MutableClock.startingAt("2025-01-01T00:00:00Z"), 100),
                meterRegistry, 0, 50_000, -1, 5, 5, 20, 5);

        assertThat(clamped.ruleFor(EndpointClass.DEFAULT).windowMs()).isEqualTo(60_000);
        assertThat(clamped.ruleFor(EndpointClass.DEFAULT).maxRequests()).isEqualTo(RateLimitService.MAX_LIMIT);
        assertThat(clamped.ruleFor(EndpointClass.PUBLISH).maxRequests()).isEqualTo(10);
    }

    @Test
    @DisplayName("Ceilings up to 10000 are kept as configured")
    void highCeilingsKept() {
        RateLimitService generous = new RateLimitService(
                new InMemoryRateLimiter(MutableClock.startingAt("2025-01-01T00:00:00Z"), 100),
                meterRegistry, 60, 5_000, 10_000, 5, 5, 20, 5);

        assertThat(generous.ruleFor(EndpointClass.DEFAULT).maxRequests()).isEqualTo(5_000);
        assertThat(generous.ruleFor(EndpointClass.PUBLISH).maxRequests()).isEqualTo(10_000);
        assertThat(RateLimitService.MAX_LIMIT).isEqualTo(10_000);
    }

    @Test
    @DisplayName("Keys are prefixed with the endpoint class")
    void keyFormat() {
        assertThat(RateLimitService.key("ip:1.2.3.4", EndpointClass.REVOKE)).isEqualTo("revoke:ip:1.2.3.4");
    }
}
