package com.securenotify.keysvc.domain.ratelimit;

import java.time.Instant;

/**
 * Outcome of one admission check. {@code retryAfterSeconds} is set only on denial.
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        int remaining,
        Instant resetAt,
        Long retryAfterSeconds
) {

    public static RateLimitDecision allow(int limit, int remaining, Instant resetAt) {
        return new RateLimitDecision(true, limit, Math.max(0, remaining), resetAt, null);
    }

    public static RateLimitDecision deny(int limit, Instant resetAt, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, resetAt, Math.max(1, retryAfterSeconds));
    }

    /**
     * Denial used when the backing store cannot answer.
     */
    public static RateLimitDecision unavailable(RateLimitRule rule, Instant now) {
        return deny(rule.maxRequests(), now.plusMillis(rule.windowMs()), rule.windowSeconds());
    }
}
