package com.securenotify.keysvc.shared.exception;

import java.time.Duration;
import java.util.Map;

public final class RateLimitedException extends KeyServiceException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("Rate limit exceeded");
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public long getRetryAfterSeconds() {
        return retryAfter.toSeconds();
    }

    @Override
    public String getErrorCode() {
        return "RATE_LIMITED";
    }

    @Override
    public int getHttpStatus() {
        return 429;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return Map.of("retryAfter", getRetryAfterSeconds());
    }
}
