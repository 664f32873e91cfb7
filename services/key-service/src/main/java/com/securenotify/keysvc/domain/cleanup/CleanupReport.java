package com.securenotify.keysvc.domain.cleanup;

import java.time.Instant;
import java.util.List;

/**
 * Counts are rows this run actually changed; {@code errors} names the batches that failed.
 */
public record CleanupReport(
        int expiredCount,
        int deletedCount,
        int purgedConfirmationCount,
        List<String> errors,
        Instant cleanedUpAt
) {

    public CleanupReport {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
