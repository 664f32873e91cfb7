package com.securenotify.keysvc.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RevocationStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    EXPIRED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
