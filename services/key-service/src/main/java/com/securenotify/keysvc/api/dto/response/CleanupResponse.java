package com.securenotify.keysvc.api.dto.response;

import com.securenotify.keysvc.domain.cleanup.CleanupReport;

import java.time.Instant;
import java.util.List;

public record CleanupResponse(
    int expiredCount,
    int deletedCount,
    int purgedConfirmationCount,
    List<String> errors,
    Instant cleanedUpAt
) {
    public static CleanupResponse from(CleanupReport report) {
        return new CleanupResponse(report.expiredCount(), report.deletedCount(),
                report.purgedConfirmationCount(), report.errors(), report.cleanedUpAt());
    }
}
