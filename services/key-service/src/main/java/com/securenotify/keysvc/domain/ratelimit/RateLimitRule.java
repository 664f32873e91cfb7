package com.securenotify.keysvc.domain.ratelimit;

/**
 * Admission ceiling: at most {@code maxRequests} within any {@code windowMs} span.
 */
public record RateLimitRule(long windowMs, int maxRequests) {

    public RateLimitRule {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
    }

    public long windowSeconds() {
        return Math.max(1, (windowMs + 999) / 1000);
    }
}
