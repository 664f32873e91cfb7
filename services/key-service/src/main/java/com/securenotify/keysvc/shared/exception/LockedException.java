package com.securenotify.keysvc.shared.exception;

import java.time.Duration;
import java.util.Map;

public final class LockedException extends KeyServiceException {

    private final Duration retryAfter;

    public LockedException(Duration retryAfter) {
        super("Too many failed attempts. Please try again later.");
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
        return "LOCKED";
    }

    @Override
    public int getHttpStatus() {
        return 423;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return Map.of("retryAfter", getRetryAfterSeconds());
    }
}
