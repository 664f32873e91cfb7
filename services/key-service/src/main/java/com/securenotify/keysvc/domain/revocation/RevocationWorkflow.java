package com.securenotify.keysvc.domain.revocation;

import com.securenotify.keysvc.domain.credential.AuthenticatedCredential;
import com.securenotify.keysvc.domain.credential.CredentialService;
import com.securenotify.keysvc.domain.credential.Permissions;
import com.securenotify.keysvc.domain.model.PublicKey;
import com.securenotify.keysvc.domain.model.RevocationConfirmation;
import com.securenotify.keysvc.infrastructure.logging.AuditAction;
import com.securenotify.keysvc.infrastructure.logging.AuditEvent;
import com.securenotify.keysvc.infrastructure.logging.AuditLogger;
import com.securenotify.keysvc.infrastructure.outbox.OutboxPublisher;
import com.securenotify.keysvc.infrastructure.persistence.PublicKeyRepository;
import com.securenotify.keysvc.shared.exception.AlreadyRevokedException;
import com.securenotify.keysvc.shared.exception.ExpiredException;
import com.securenotify.keysvc.shared.exception.InvalidCodeException;
import com.securenotify.keysvc.shared.exception.InvalidStateException;
import com.securenotify.keysvc.shared.exception.LockedException;
import com.securenotify.keysvc.shared.exception.NotFoundException;
import com.securenotify.keysvc.shared.exception.PermissionDeniedException;
import com.securenotify.keysvc.shared.exception.RevocationPendingException;
import com.securenotify.keysvc.shared.exception.ValidationException;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import com.securenotify.keysvc.shared.validation.FieldError;
import com.securenotify.keysvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Two-phase key revocation: a request issues a one-time code, a confirmation with that code
 * soft-deletes the key. Authentication, permission and input checks all run before any write.
 */
@Service
@Slf4j
public class RevocationWorkflow {

    public static final String EVENT_KEY_REVOKED = "PublicKeyRevoked";

    private final ConfirmationLifecycle lifecycle;
    private final PublicKeyRepository publicKeyRepository;
    private final CredentialService credentialService;
    private final ValidationService validationService;
    private final OutboxPublisher outboxPublisher;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RevocationWorkflow(
            ConfirmationLifecycle lifecycle,
            PublicKeyRepository publicKeyRepository,
            CredentialService credentialService,
            ValidationService validationService,
            OutboxPublisher outboxPublisher,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.lifecycle = lifecycle;
        this.publicKeyRepository = publicKeyRepository;
        this.credentialService = credentialService;
        this.validationService = validationService;
        this.outboxPublisher = outboxPublisher;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Opens a revocation for the key and returns the plaintext confirmation code.
     * Repeating the request while one is pending yields {@link RevocationPendingException}
     * carrying the existing confirmation id.
     */
    public RevocationTicket requestRevocation(UUID keyId, String rawApiKey, String reason, Integer expiryHours) {
        AuthenticatedCredential credential = authorize(rawApiKey);
        validationService.validateRevocationRequest(reason, expiryHours).throwIfInvalid();

        PublicKey key = publicKeyRepository.findById(keyId)
                .orElseThrow(() -> new NotFoundException("Key"));
        requireOwnership(credential, key);

        if (key.isDeleted()) {
            RevocationConfirmation confirmed = lifecycle.findLatestConfirmedForTarget(keyId).orElse(null);
            throw new AlreadyRevokedException(keyId,
                    confirmed == null ? null : confirmed.getId(),
                    confirmed == null ? null : confirmed.getExpiresAt());
        }

        lifecycle.findActivePendingForTarget(keyId).ifPresent(pending -> {
            throw new RevocationPendingException(pending.getId(), pending.getExpiresAt());
        });

        String normalizedReason = validationService.normalizeReason(reason);
        IssuedConfirmation issued;
        try {
            issued = transactionTemplate.execute(status ->
                    lifecycle.create(keyId, credential.apiKeyId(), normalizedReason, expiryHours));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent revocation request lost the race: keyId={}", keyId);
            RevocationConfirmation winner = lifecycle.findPendingForTarget(keyId)
                    .orElseThrow(() -> e);
            throw new RevocationPendingException(winner.getId(), winner.getExpiresAt());
        }

        RevocationConfirmation confirmation = issued.confirmation();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("revocationId", confirmation.getId().toString());
        metadata.put("channelId", key.getChannelId());
        metadata.put("reason", normalizedReason);
        metadata.put("expiresAt", confirmation.getExpiresAt().toString());
        auditLogger.logAudit(AuditEvent.success(AuditAction.KEY_REVOKE_REQUEST, credential.userId(),
                keyId.toString(), securityUtils.getCurrentCorrelationId(), "Key revocation requested", metadata));

        return new RevocationTicket(confirmation.getId(), keyId, confirmation.getExpiresAt(), issued.plaintextCode());
    }

    /**
     * Confirms a pending revocation and soft-deletes the key. Failed attempts, lockouts and
     * lazy expiry are committed even though the call fails.
     */
    @Transactional(noRollbackFor = {InvalidCodeException.class, LockedException.class, ExpiredException.class})
    public RevocationOutcome confirmRevocation(UUID revocationId, String code, String rawApiKey) {
        AuthenticatedCredential credential = authorize(rawApiKey);
        if (code == null || code.isBlank()) {
            throw new ValidationException(FieldError.required("confirmationCode", "Confirmation code"));
        }

        RevocationConfirmation confirmation = lifecycle.findById(revocationId)
                .orElseThrow(() -> new NotFoundException("Revocation"));
        PublicKey key = publicKeyRepository.findById(confirmation.getTargetId()).orElse(null);
        if (key != null) {
            requireOwnership(credential, key);
        }

        VerificationResult result = lifecycle.verify(revocationId, code.trim());
        switch (result.outcome()) {
            case VALID -> {
                // fall through to the transition below
            }
            case NOT_FOUND -> throw new NotFoundException("Revocation");
            case LOCKED -> throw lockedFor(result.confirmation());
            case EXPIRED -> throw new ExpiredException();
            case NOT_PENDING -> throw new InvalidStateException(
                    "Revocation is already " + result.confirmation().getStatus().toJson());
            case INVALID_CODE -> {
                auditLogger.logAudit(AuditEvent.failure(AuditAction.KEY_REVOKE_FAILED, credential.userId(),
                        confirmation.getTargetId().toString(), securityUtils.getCurrentCorrelationId(),
                        "Invalid confirmation code",
                        Map.of("revocationId", revocationId.toString(),
                                "attemptCount", result.confirmation().getAttemptCount())));
                throw new InvalidCodeException(lifecycle.attemptsRemaining(result.confirmation()));
            }
        }

        if (key == null) {
            throw new NotFoundException("Key");
        }
        Map<String, Object> snapshot = key.snapshot();
        Instant now = clock.instant();

        if (!lifecycle.confirm(revocationId, credential.userId())) {
            throw new InvalidStateException("Revocation is no longer pending");
        }
        if (publicKeyRepository.softDelete(key.getId(), now, credential.userId(), confirmation.getReason()) == 0) {
            throw new AlreadyRevokedException(key.getId(), null, null);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("keyId", key.getId().toString());
        payload.put("channelId", key.getChannelId());
        payload.put("revocationId", revocationId.toString());
        payload.put("revokedBy", credential.userId());
        payload.put("revokedAt", now.toString());
        outboxPublisher.publish("PublicKey", key.getId(), EVENT_KEY_REVOKED, payload);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("revocationId", revocationId.toString());
        metadata.put("reason", confirmation.getReason());
        metadata.put("keySnapshot", snapshot);
        auditLogger.logAudit(AuditEvent.success(AuditAction.KEY_REVOKE_CONFIRMED, credential.userId(),
                key.getId().toString(), securityUtils.getCurrentCorrelationId(), "Key revoked", metadata));

        log.info("Key revoked: keyId={}, revocationId={}", key.getId(), revocationId);
        return new RevocationOutcome(revocationId, key.getId(), key.getChannelId(), now);
    }

    @Transactional
    public RevocationStatusView cancelRevocation(UUID revocationId, String rawApiKey) {
        AuthenticatedCredential credential = authorize(rawApiKey);

        RevocationConfirmation confirmation = lifecycle.findById(revocationId)
                .orElseThrow(() -> new NotFoundException("Revocation"));
        PublicKey key = publicKeyRepository.findById(confirmation.getTargetId()).orElse(null);
        if (key != null) {
            requireOwnership(credential, key);
        }

        if (!confirmation.isPending()) {
            throw new InvalidStateException("Revocation is already " + confirmation.getStatus().toJson());
        }
        if (!lifecycle.cancel(revocationId, credential.userId())) {
            throw new InvalidStateException("Revocation is no longer pending");
        }

        auditLogger.logAudit(AuditEvent.success(AuditAction.KEY_REVOKE_CANCELLED, credential.userId(),
                confirmation.getTargetId().toString(), securityUtils.getCurrentCorrelationId(),
                "Key revocation cancelled", Map.of("revocationId", revocationId.toString())));

        RevocationConfirmation cancelled = lifecycle.findById(revocationId).orElse(confirmation);
        return RevocationStatusView.of(cancelled, key, clock.instant());
    }

    @Transactional(readOnly = true)
    public RevocationStatusView getStatus(UUID revocationId, String rawApiKey) {
        AuthenticatedCredential credential = authorize(rawApiKey);

        RevocationConfirmation confirmation = lifecycle.findById(revocationId)
                .orElseThrow(() -> new NotFoundException("Revocation"));
        PublicKey key = publicKeyRepository.findById(confirmation.getTargetId()).orElse(null);
        if (key != null) {
            requireOwnership(credential, key);
        }
        return RevocationStatusView.of(confirmation, key, clock.instant());
    }

    @Transactional(readOnly = true)
    public RevocationStatusView getPendingForKey(UUID keyId, String rawApiKey) {
        AuthenticatedCredential credential = authorize(rawApiKey);

        PublicKey key = publicKeyRepository.findById(keyId)
                .orElseThrow(() -> new NotFoundException("Key"));
        requireOwnership(credential, key);

        Instant now = clock.instant();
        return lifecycle.findPendingForTarget(keyId)
                .filter(pending -> !pending.isExpiredAt(now))
                .map(pending -> RevocationStatusView.of(pending, key, now))
                .orElseThrow(() -> new NotFoundException("Pending revocation"));
    }

    private AuthenticatedCredential authorize(String rawApiKey) {
        AuthenticatedCredential credential = credentialService.authenticate(rawApiKey);
        credentialService.requirePermission(credential, Permissions.KEY_REVOKE);
        securityUtils.setMdcContext(null, credential.userId());
        return credential;
    }

    private void requireOwnership(AuthenticatedCredential credential, PublicKey key) {
        if (credential.isAdmin() || key.getOwnerId() == null || key.getOwnerId().equals(credential.userId())) {
            return;
        }
        auditLogger.logAudit(AuditEvent.failure(AuditAction.PERMISSION_DENIED, credential.userId(),
                key.getId().toString(), securityUtils.getCurrentCorrelationId(), "Key belongs to another owner",
                Map.of("required", Permissions.KEY_REVOKE)));
        throw new PermissionDeniedException(Permissions.KEY_REVOKE);
    }

    private LockedException lockedFor(RevocationConfirmation confirmation) {
        Instant lockedUntil = confirmation.getLockedUntil();
        Duration retryAfter = lockedUntil == null
                ? lifecycle.getLockoutDuration()
                : Duration.between(clock.instant(), lockedUntil);
        if (retryAfter.compareTo(Duration.ofSeconds(1)) < 0) {
            retryAfter = Duration.ofSeconds(1);
        }
        return new LockedException(retryAfter);
    }
}
