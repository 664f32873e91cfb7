package com.securenotify.keysvc.domain.cleanup;

public record CleanupStatus(long pendingConfirmations, long revokedKeys, long purgeableKeys, int retentionDays) {
}
