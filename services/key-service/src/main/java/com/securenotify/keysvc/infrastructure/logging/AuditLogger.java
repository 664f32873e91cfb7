package com.securenotify.keysvc.infrastructure.logging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes audit and security events as single-line JSON, off the request thread.
 * Failures to write are logged and never reach the caller.
 */
@Component
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final String SERVICE_ID = "key-service";

    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    public AuditLogger(SecurityUtils securityUtils, ObjectMapper objectMapper) {
        this.securityUtils = securityUtils;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<Void> logAudit(AuditEvent event) {
        return CompletableFuture.runAsync(() -> {
            Map<String, Object> entry = baseEntry("AUDIT", event.action(), event.description(),
                    event.correlationId(), event.metadata());
            entry.put("success", event.success());
            if (event.actorId() != null) {
                entry.put("actorId", event.actorId());
            }
            if (event.keyId() != null) {
                entry.put("keyId", event.keyId());
            }
            entry.put("timestamp", String.valueOf(event.timestamp()));
            write("AUDIT", entry);
        });
    }

    public CompletableFuture<Void> logSecurity(SecurityEvent event) {
        return CompletableFuture.runAsync(() -> {
            Map<String, Object> entry = baseEntry("SECURITY", event.action(), event.description(),
                    event.correlationId(), event.metadata());
            entry.put("maskedIp", securityUtils.maskIp(event.ipAddress()));
            entry.put("timestamp", String.valueOf(event.timestamp()));
            write("SECURITY", entry);
        });
    }

    private Map<String, Object> baseEntry(String level, AuditAction action, String description,
                                          String correlationId, Map<String, Object> metadata) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("action", action.code());
        entry.put("description", description);
        entry.put("serviceId", SERVICE_ID);
        entry.put("correlationId", correlationId);
        if (!metadata.isEmpty()) {
            entry.put("metadata", metadata);
        }
        return entry;
    }

    private void write(String level, Map<String, Object> entry) {
        try {
            String json = objectMapper.writeValueAsString(entry);
            if ("SECURITY".equals(level)) {
                log.warn("[SECURITY] {}", json);
            } else {
                log.info("[AUDIT] {}", json);
            }
        } catch (Exception e) {
            log.error("Failed to write {} log: {}", level, e.getMessage());
        }
    }
}
