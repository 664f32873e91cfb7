package com.securenotify.keysvc.infrastructure.logging;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audited key-service action. {@code actorId} is the owner of the calling API key,
 * or {@code system} for scheduled work; {@code keyId} is the public key acted on, when there is one.
 * Metadata must never hold confirmation codes or key material.
 */
public record AuditEvent(
        AuditAction action,
        String actorId,
        String keyId,
        String correlationId,
        boolean success,
        String description,
        Map<String, Object> metadata,
        Instant timestamp
) {

    public static final String SYSTEM_ACTOR = "system";

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AuditEvent success(AuditAction action, String actorId, String keyId,
                                     String correlationId, String description, Map<String, Object> metadata) {
        return new AuditEvent(action, actorId, keyId, correlationId, true, description, metadata, Instant.now());
    }

    public static AuditEvent failure(AuditAction action, String actorId, String keyId,
                                     String correlationId, String description, Map<String, Object> metadata) {
        return new AuditEvent(action, actorId, keyId, correlationId, false, description, metadata, Instant.now());
    }

    public static AuditEvent system(AuditAction action, String correlationId, String description,
                                    Map<String, Object> metadata) {
        return new AuditEvent(action, SYSTEM_ACTOR, null, correlationId, true, description, metadata, Instant.now());
    }
}
