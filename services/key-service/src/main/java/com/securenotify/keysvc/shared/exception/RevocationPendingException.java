package com.securenotify.keysvc.shared.exception;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A pending confirmation already exists for the key. Surfaces it instead of creating a duplicate.
 */
public final class RevocationPendingException extends KeyServiceException {

    private final UUID revocationId;
    private final Instant expiresAt;

    public RevocationPendingException(UUID revocationId, Instant expiresAt) {
        super("Revocation already pending");
        this.revocationId = revocationId;
        this.expiresAt = expiresAt;
    }

    public UUID getRevocationId() {
        return revocationId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String getErrorCode() {
        return "REVOCATION_PENDING";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return Map.of("revocationId", revocationId, "expiresAt", expiresAt);
    }
}
