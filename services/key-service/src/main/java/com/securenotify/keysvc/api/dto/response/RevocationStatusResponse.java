package com.securenotify.keysvc.api.dto.response;

import com.securenotify.keysvc.domain.model.RevocationStatus;
import com.securenotify.keysvc.domain.revocation.RevocationStatusView;

import java.time.Instant;
import java.util.UUID;

public record RevocationStatusResponse(
    UUID revocationId,
    RevocationStatus status,
    UUID keyId,
    String channelId,
    String reason,
    int attemptCount,
    boolean locked,
    Instant expiresAt,
    Instant createdAt,
    Instant confirmedAt,
    String confirmedBy,
    Instant revokedAt,
    String revokedBy
) {
    public static RevocationStatusResponse from(RevocationStatusView view) {
        return new RevocationStatusResponse(
                view.revocationId(),
                view.status(),
                view.keyId(),
                view.channelId(),
                view.reason(),
                view.attemptCount(),
                view.locked(),
                view.expiresAt(),
                view.createdAt(),
                view.confirmedAt(),
                view.confirmedBy(),
                view.revokedAt(),
                view.revokedBy());
    }
}
