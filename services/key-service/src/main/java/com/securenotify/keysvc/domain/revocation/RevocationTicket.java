package com.securenotify.keysvc.domain.revocation;

import java.time.Instant;
import java.util.UUID;

/**
 * Handed back once when a revocation is requested. The confirmation code is not retrievable later.
 */
public record RevocationTicket(UUID revocationId, UUID keyId, Instant expiresAt, String confirmationCode) {

    @Override
    public String toString() {
        return "RevocationTicket[revocationId=" + revocationId + ", keyId=" + keyId + ", expiresAt=" + expiresAt + "]";
    }
}
