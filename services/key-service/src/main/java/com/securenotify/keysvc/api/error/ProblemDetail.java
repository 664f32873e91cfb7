package com.securenotify.keysvc.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * RFC 7807 problem body returned for every failed key-service request.
 * The {@code type} URI and {@code title} are derived from the error code, so clients can switch on either.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemDetail(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        Instant timestamp,
        String correlationId,
        String errorCode,
        Map<String, Object> extensions
) {

    static final String TYPE_BASE = "https://api.securenotify.dev/problems/";

    public ProblemDetail {
        extensions = extensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static ProblemDetail forCode(String errorCode, int status, String detail, String instance,
                                        String correlationId, Map<String, Object> extensions) {
        return new ProblemDetail(typeFor(errorCode), titleFor(errorCode), status, detail, instance,
                Instant.now(), correlationId, errorCode, extensions);
    }

    /** {@code RATE_LIMITED} becomes {@code .../problems/rate-limited}. */
    static String typeFor(String errorCode) {
        return TYPE_BASE + errorCode.toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** {@code INVALID_CODE} becomes {@code Invalid code}. */
    static String titleFor(String errorCode) {
        String words = errorCode.replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    public boolean isServerError() {
        return status >= 500;
    }
}
