package com.securenotify.keysvc.domain.revocation;

import java.time.Instant;
import java.util.UUID;

public record RevocationOutcome(UUID revocationId, UUID deletedKeyId, String channelId, Instant revokedAt) {
}
