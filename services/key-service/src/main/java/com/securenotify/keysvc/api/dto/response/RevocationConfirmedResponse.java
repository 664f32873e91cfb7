package com.securenotify.keysvc.api.dto.response;

import java.time.Instant;
import java.util.UUID;

public record RevocationConfirmedResponse(
    UUID revocationId,
    UUID deletedKeyId,
    String channelId,
    Instant revokedAt
) {}
