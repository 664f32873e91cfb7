package com.securenotify.keysvc.domain.revocation;

import com.securenotify.keysvc.domain.model.PublicKey;
import com.securenotify.keysvc.domain.model.RevocationConfirmation;
import com.securenotify.keysvc.domain.model.RevocationStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a confirmation and, while it still exists, the key it targets.
 * A pending record past its expiry is reported as expired.
 */
public record RevocationStatusView(
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

    public static RevocationStatusView of(RevocationConfirmation confirmation, PublicKey key, Instant now) {
        RevocationStatus status = confirmation.isPending() && confirmation.isExpiredAt(now)
                ? RevocationStatus.EXPIRED
                : confirmation.getStatus();
        return new RevocationStatusView(
                confirmation.getId(),
                status,
                confirmation.getTargetId(),
                key == null ? null : key.getChannelId(),
                confirmation.getReason(),
                confirmation.getAttemptCount(),
                confirmation.isLockedAt(now),
                confirmation.getExpiresAt(),
                confirmation.getCreatedAt(),
                confirmation.getConfirmedAt(),
                confirmation.getConfirmedBy(),
                key == null ? null : key.getRevokedAt(),
                key == null ? null : key.getRevokedBy());
    }
}
