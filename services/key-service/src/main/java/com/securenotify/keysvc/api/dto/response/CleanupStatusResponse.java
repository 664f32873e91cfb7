package com.securenotify.keysvc.api.dto.response;

public record CleanupStatusResponse(
    long pendingConfirmations,
    long revokedKeys,
    long purgeableKeys,
    int retentionDays
) {}
