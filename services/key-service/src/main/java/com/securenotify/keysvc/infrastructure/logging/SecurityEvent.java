package com.securenotify.keysvc.infrastructure.logging;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A rejected or suspicious call: unknown API keys, bad cleanup secrets.
 * Carries the raw client address; {@link AuditLogger} masks it before writing.
 */
public record SecurityEvent(
        AuditAction action,
        String ipAddress,
        String correlationId,
        String description,
        Map<String, Object> metadata,
        Instant timestamp
) {

    public SecurityEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static SecurityEvent of(AuditAction action, String ipAddress, String correlationId,
                                   String description, Map<String, Object> metadata) {
        return new SecurityEvent(action, ipAddress, correlationId, description, metadata, Instant.now());
    }
}
