package com.securenotify.keysvc.shared.security;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Centralized security utilities for IP/identifier masking, correlation ID, and MDC management.
 */
@Component
public class SecurityUtils {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String ACTOR_ID_KEY = "actorId";
    private static final Pattern CORRELATION_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern IPV4_PATTERN = Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\\.\\d{1,3}$");

    /**
     * Masks an IPv4 address by replacing the last octet with ***.
     * Example: 192.168.1.100 -> 192.168.1.***
     */
    public String maskIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return "***";
        }
        var matcher = IPV4_PATTERN.matcher(ip.trim());
        if (matcher.matches()) {
            return matcher.group(1) + ".***";
        }
        return ip.length() > 6 ? ip.substring(0, 6) + "***" : "***";
    }

    /**
     * Keeps the first 8 and last 4 characters of an identifier.
     * Example: 3f2a9c1e-...-4b7d -> 3f2a9c1e...4b7d
     */
    public String maskIdentifier(String id) {
        if (id == null || id.isBlank()) {
            return "***";
        }
        if (id.length() <= 12) {
            return id.substring(0, Math.min(4, id.length())) + "***";
        }
        return id.substring(0, 8) + "..." + id.substring(id.length() - 4);
    }

    /**
     * First hop of X-Forwarded-For, then X-Real-IP, then the socket address.
     */
    public String resolveClientIp(String forwardedFor, String realIp, String remoteAddr) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return remoteAddr == null ? "unknown" : remoteAddr;
    }

    /**
     * Reuses a caller-supplied correlation id only if it is short and made of safe characters,
     * so it can be echoed in headers and log lines as-is.
     */
    public String getOrCreateCorrelationId(String provided) {
        if (provided != null && CORRELATION_ID_PATTERN.matcher(provided.trim()).matches()) {
            return provided.trim();
        }
        return UUID.randomUUID().toString();
    }

    public void setMdcContext(String correlationId, String actorId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        if (actorId != null) {
            MDC.put(ACTOR_ID_KEY, actorId);
        }
    }

    public void clearMdcContext() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(ACTOR_ID_KEY);
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }
}
