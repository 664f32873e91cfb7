package com.securenotify.keysvc.infrastructure.logging;

import java.util.Locale;

public enum AuditAction {
    KEY_REVOKE_REQUEST,
    KEY_REVOKE_CONFIRMED,
    KEY_REVOKE_CANCELLED,
    KEY_REVOKE_FAILED,
    AUTH_FAILURE,
    PERMISSION_DENIED,
    CLEANUP_EXECUTED,
    CLEANUP_UNAUTHORIZED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
