package com.securenotify.keysvc.api.dto.response;

import com.securenotify.keysvc.domain.model.RevocationStatus;

import java.time.Instant;
import java.util.UUID;

public record RevocationRequestedResponse(
    UUID revocationId,
    UUID keyId,
    RevocationStatus status,
    Instant expiresAt,
    String confirmationCode,
    String message
) {
    @Override
    public String toString() {
        return "RevocationRequestedResponse[revocationId=" + revocationId + ", keyId=" + keyId + "]";
    }
}
