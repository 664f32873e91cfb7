package com.securenotify.keysvc.shared.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The key is already soft-deleted. Carries the confirmation that revoked it when one is known.
 */
public final class AlreadyRevokedException extends KeyServiceException {

    private final UUID keyId;
    private final UUID revocationId;
    private final Instant expiresAt;

    public AlreadyRevokedException(UUID keyId, UUID revocationId, Instant expiresAt) {
        super("Key already revoked");
        this.keyId = keyId;
        this.revocationId = revocationId;
        this.expiresAt = expiresAt;
    }

    public UUID getKeyId() {
        return keyId;
    }

    public UUID getRevocationId() {
        return revocationId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String getErrorCode() {
        return "ALREADY_REVOKED";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }

    @Override
    public Map<String, Object> getExtensions() {
        Map<String, Object> extensions = new HashMap<>();
        extensions.put("keyId", keyId);
        if (revocationId != null) {
            extensions.put("revocationId", revocationId);
            extensions.put("expiresAt", expiresAt);
        }
        return extensions;
    }
}
