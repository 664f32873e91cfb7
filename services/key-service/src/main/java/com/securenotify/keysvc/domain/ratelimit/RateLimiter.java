package com.securenotify.keysvc.domain.ratelimit;

/**
 * Sliding-window admission control. Implementations must be safe for concurrent callers
 * and must deny when they cannot reach their backing store.
 */
public interface RateLimiter {

    /**
     * Checks the key against the rule and, when admitted, records the request.
     */
    RateLimitDecision check(String key, RateLimitRule rule);

    /**
     * Drops state that can no longer affect any decision.
     */
    default void sweep() {
    }

    String storeName();
}
