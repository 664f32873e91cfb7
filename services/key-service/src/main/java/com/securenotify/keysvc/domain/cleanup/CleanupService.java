package com.securenotify.keysvc.domain.cleanup;

import com.securenotify.keysvc.config.SettingsBounds;
import com.securenotify.keysvc.domain.model.RevocationStatus;
import com.securenotify.keysvc.infrastructure.logging.AuditAction;
import com.securenotify.keysvc.infrastructure.logging.AuditEvent;
import com.securenotify.keysvc.infrastructure.logging.AuditLogger;
import com.securenotify.keysvc.infrastructure.logging.SecurityEvent;
import com.securenotify.keysvc.infrastructure.persistence.PublicKeyRepository;
import com.securenotify.keysvc.infrastructure.persistence.RevocationConfirmationRepository;
import com.securenotify.keysvc.shared.crypto.SecureCompare;
import com.securenotify.keysvc.shared.exception.CleanupUnauthorizedException;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Expires overdue confirmations and hard-deletes revoked keys past the retention window.
 * Each delete batch commits on its own; a failed batch is reported and the rest still run.
 */
@Service
@Slf4j
public class CleanupService {

    public static final int MIN_SECRET_LENGTH = 32;
    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_BATCH_SIZE = 500;

    private static final Set<String> PLACEHOLDER_SECRETS = Set.of(
            "change-me", "changeme", "change-me-in-production", "your-cleanup-secret",
            "your-cleanup-secret-here", "your-secret-here", "placeholder", "secret");

    private final RevocationConfirmationRepository confirmationRepository;
    private final PublicKeyRepository publicKeyRepository;
    private final TransactionTemplate transactionTemplate;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Clock clock;
    private final String cleanupSecret;
    private final int retentionDays;
    private final int batchSize;

    public CleanupService(
            RevocationConfirmationRepository confirmationRepository,
            PublicKeyRepository publicKeyRepository,
            TransactionTemplate transactionTemplate,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            Clock clock,
            @Value("${app.cleanup.secret:}") String cleanupSecret,
            @Value("${app.cleanup.retention-days:30}") int retentionDays,
            @Value("${app.cleanup.batch-size:500}") int batchSize) {
        this.confirmationRepository = confirmationRepository;
        this.publicKeyRepository = publicKeyRepository;
        this.transactionTemplate = transactionTemplate;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.clock = clock;
        this.cleanupSecret = cleanupSecret == null ? "" : cleanupSecret.trim();
        this.retentionDays = SettingsBounds.bounded("app.cleanup.retention-days",
                retentionDays, DEFAULT_RETENTION_DAYS, 1, 365);
        this.batchSize = SettingsBounds.bounded("app.cleanup.batch-size",
                batchSize, DEFAULT_BATCH_SIZE, 1, 5000);
        if (!isSecretUsable()) {
            log.warn("Cleanup secret is missing, too short or a placeholder; manual cleanup triggers are disabled");
        }
    }

    /**
     * Runs a full cleanup for a caller presenting the shared secret.
     *
     * @throws CleanupUnauthorizedException when the secret is wrong or none is configured
     */
    public CleanupReport trigger(String providedSecret, String ipAddress) {
        authorize(providedSecret, ipAddress);
        CleanupReport report = executeFullCleanup();
        auditLogger.logAudit(AuditEvent.system(AuditAction.CLEANUP_EXECUTED,
                securityUtils.getCurrentCorrelationId(), "Cleanup executed",
                Map.of("expiredCount", report.expiredCount(),
                        "deletedCount", report.deletedCount(),
                        "purgedConfirmationCount", report.purgedConfirmationCount(),
                        "errorCount", report.errors().size())));
        return report;
    }

    public CleanupStatus status(String providedSecret, String ipAddress) {
        authorize(providedSecret, ipAddress);
        return status();
    }

    public CleanupStatus status() {
        Instant cutoff = retentionCutoff();
        return new CleanupStatus(
                confirmationRepository.countByStatus(RevocationStatus.PENDING),
                publicKeyRepository.countByDeletedTrue(),
                publicKeyRepository.countRevokedBefore(cutoff),
                retentionDays);
    }

    public CleanupReport executeFullCleanup() {
        List<String> errors = new ArrayList<>();
        int expired = 0;
        try {
            expired = expirePendingConfirmations();
        } catch (RuntimeException e) {
            log.error("Expiring pending confirmations failed", e);
            errors.add("expire: " + e.getMessage());
        }
        int deleted = purgeRevokedKeys(errors);
        int purged = purgeExpiredConfirmations(errors);

        CleanupReport report = new CleanupReport(expired, deleted, purged, errors, clock.instant());
        log.info("Cleanup finished: expired={}, deletedKeys={}, purgedConfirmations={}, errors={}",
                expired, deleted, purged, errors.size());
        return report;
    }

    /**
     * Moves every overdue pending confirmation to EXPIRED in one statement.
     * Records already expired lazily are not counted again.
     */
    public int expirePendingConfirmations() {
        Instant now = clock.instant();
        Integer expired = transactionTemplate.execute(status -> confirmationRepository.expireAllPendingBefore(now));
        return expired == null ? 0 : expired;
    }

    public int purgeRevokedKeys(List<String> errors) {
        List<UUID> ids = select("revoked keys", errors,
                () -> publicKeyRepository.findRevokedIdsBefore(retentionCutoff()));
        return inBatches("revoked keys", ids, errors, batch -> {
            confirmationRepository.deleteByTargetIds(batch);
            return publicKeyRepository.deleteRevokedByIds(batch);
        });
    }

    public int purgeExpiredConfirmations(List<String> errors) {
        List<UUID> ids = select("expired confirmations", errors,
                () -> confirmationRepository.findExpiredIdsBefore(retentionCutoff()));
        return inBatches("expired confirmations", ids, errors, confirmationRepository::deleteExpiredByIds);
    }

    public boolean isSecretUsable() {
        return cleanupSecret.length() >= MIN_SECRET_LENGTH
                && !PLACEHOLDER_SECRETS.contains(cleanupSecret.toLowerCase(Locale.ROOT));
    }

    /**
     * Runs a selection query; a failure is recorded in {@code errors} and yields nothing to purge.
     */
    private List<UUID> select(String label, List<String> errors, Supplier<List<UUID>> query) {
        try {
            return query.get();
        } catch (RuntimeException e) {
            log.error("Selecting {} for cleanup failed", label, e);
            errors.add(label + " selection: " + e.getMessage());
            return List.of();
        }
    }

    private int inBatches(String label, List<UUID> ids, List<String> errors, Function<List<UUID>, Integer> action) {
        int total = 0;
        for (int start = 0, batchNo = 1; start < ids.size(); start += batchSize, batchNo++) {
            List<UUID> batch = List.copyOf(ids.subList(start, Math.min(start + batchSize, ids.size())));
            try {
                Integer affected = transactionTemplate.execute(status -> action.apply(batch));
                total += affected == null ? 0 : affected;
            } catch (RuntimeException e) {
                log.error("Cleanup batch {} of {} failed ({} ids)", batchNo, label, batch.size(), e);
                errors.add(label + " batch " + batchNo + ": " + e.getMessage());
            }
        }
        return total;
    }

    private void authorize(String providedSecret, String ipAddress) {
        boolean accepted = isSecretUsable()
                && providedSecret != null
                && SecureCompare.constantTimeEqual(cleanupSecret, providedSecret);
        if (!accepted) {
            auditLogger.logSecurity(SecurityEvent.of(AuditAction.CLEANUP_UNAUTHORIZED, ipAddress,
                    securityUtils.getCurrentCorrelationId(), "Cleanup trigger rejected",
                    Map.of("secretConfigured", isSecretUsable())));
            throw new CleanupUnauthorizedException();
        }
    }

    private Instant retentionCutoff() {
        return clock.instant().minus(Duration.ofDays(retentionDays));
    }
}
