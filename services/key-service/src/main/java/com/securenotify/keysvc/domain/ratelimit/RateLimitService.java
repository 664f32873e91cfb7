package com.securenotify.keysvc.domain.ratelimit;

import com.securenotify.keysvc.config.SettingsBounds;
import com.securenotify.keysvc.shared.exception.RateLimitedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Admission control per endpoint class and caller identity.
 * Keys take the form {@code <class>:<identity>}, e.g. {@code revoke:ip:1.2.3.4}.
 */
@Service
@Slf4j
public class RateLimitService {

    public static final int MIN_WINDOW_SECONDS = 1;
    public static final int MAX_WINDOW_SECONDS = 3600;
    public static final int DEFAULT_WINDOW_SECONDS = 60;
    public static final int MAX_LIMIT = 10_000;

    private final RateLimiter rateLimiter;
    private final Map<EndpointClass, RateLimitRule> rules;
    private final Counter deniedCounter;

    public RateLimitService(
            RateLimiter rateLimiter,
            MeterRegistry meterRegistry,
            @Value("${app.rate-limit.window-seconds:60}") int windowSeconds,
            @Value("${app.rate-limit.limits.default:100}") int defaultLimit,
            @Value("${app.rate-limit.limits.publish:10}") int publishLimit,
            @Value("${app.rate-limit.limits.register:5}") int registerLimit,
            @Value("${app.rate-limit.limits.subscribe:5}") int subscribeLimit,
            @Value("${app.rate-limit.limits.revoke:20}") int revokeLimit,
            @Value("${app.rate-limit.limits.cleanup:5}") int cleanupLimit) {
        this.rateLimiter = rateLimiter;
        long windowMs = SettingsBounds.bounded("app.rate-limit.window-seconds", windowSeconds,
                DEFAULT_WINDOW_SECONDS, MIN_WINDOW_SECONDS, MAX_WINDOW_SECONDS) * 1000L;

        this.rules = new EnumMap<>(EndpointClass.class);
        rules.put(EndpointClass.DEFAULT, rule(EndpointClass.DEFAULT, defaultLimit, windowMs));
        rules.put(EndpointClass.PUBLISH, rule(EndpointClass.PUBLISH, publishLimit, windowMs));
        rules.put(EndpointClass.REGISTER, rule(EndpointClass.REGISTER, registerLimit, windowMs));
        rules.put(EndpointClass.SUBSCRIBE, rule(EndpointClass.SUBSCRIBE, subscribeLimit, windowMs));
        rules.put(EndpointClass.REVOKE, rule(EndpointClass.REVOKE, revokeLimit, windowMs));
        rules.put(EndpointClass.CLEANUP, rule(EndpointClass.CLEANUP, cleanupLimit, windowMs));

        this.deniedCounter = Counter.builder("ratelimit_denied_total")
                .description("Requests denied by admission control")
                .register(meterRegistry);
        log.info("Rate limiting active: store={}, window={}ms", rateLimiter.storeName(), windowMs);
    }

    private static RateLimitRule rule(EndpointClass endpointClass, int configured, long windowMs) {
        int limit = SettingsBounds.bounded("app.rate-limit.limits." + endpointClass.keySegment(),
                configured, endpointClass.defaultLimit(), 1, MAX_LIMIT);
        return new RateLimitRule(windowMs, limit);
    }

    /**
     * Checks and records one request. Never throws; store failures come back as denials.
     */
    public RateLimitDecision check(String identity, EndpointClass endpointClass) {
        RateLimitDecision decision = rateLimiter.check(key(identity, endpointClass), ruleFor(endpointClass));
        if (!decision.allowed()) {
            deniedCounter.increment();
            log.warn("Rate limit exceeded: class={}, retryAfter={}s", endpointClass, decision.retryAfterSeconds());
        }
        return decision;
    }

    /**
     * @throws RateLimitedException if the request is not admitted
     */
    public RateLimitDecision enforce(String identity, EndpointClass endpointClass) {
        RateLimitDecision decision = check(identity, endpointClass);
        if (!decision.allowed()) {
            throw new RateLimitedException(Duration.ofSeconds(decision.retryAfterSeconds()));
        }
        return decision;
    }

    public RateLimitRule ruleFor(EndpointClass endpointClass) {
        return rules.get(endpointClass);
    }

    /**
     * Drops idle windows. Scheduled by {@link com.securenotify.keysvc.config.RateLimitSweepConfig}.
     */
    public void sweepStaleWindows() {
        try {
            rateLimiter.sweep();
        } catch (RuntimeException e) {
            log.warn("Rate limit sweep failed: {}", e.getMessage());
        }
    }

    static String key(String identity, EndpointClass endpointClass) {
        return endpointClass.keySegment() + ":" + identity;
    }
}
