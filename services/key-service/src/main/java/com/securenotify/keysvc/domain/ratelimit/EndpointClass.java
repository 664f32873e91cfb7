package com.securenotify.keysvc.domain.ratelimit;

import java.util.Locale;

/**
 * Groups of endpoints sharing one admission ceiling.
 */
public enum EndpointClass {
    DEFAULT(100),
    PUBLISH(10),
    REGISTER(5),
    SUBSCRIBE(5),
    REVOKE(20),
    CLEANUP(5);

    private final int defaultLimit;

    EndpointClass(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public String keySegment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
