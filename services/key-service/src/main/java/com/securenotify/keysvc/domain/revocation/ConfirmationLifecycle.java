package com.securenotify.keysvc.domain.revocation;

import com.securenotify.keysvc.config.SettingsBounds;
import com.securenotify.keysvc.domain.model.RevocationConfirmation;
import com.securenotify.keysvc.domain.model.RevocationStatus;
import com.securenotify.keysvc.domain.revocation.VerificationResult.Outcome;
import com.securenotify.keysvc.infrastructure.persistence.RevocationConfirmationRepository;
import com.securenotify.keysvc.shared.crypto.CodeHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * State machine for revocation confirmations:
 * PENDING moves to exactly one of CONFIRMED, CANCELLED or EXPIRED and never leaves it.
 * A pending record may additionally be locked after repeated wrong codes.
 */
@Service
@Slf4j
public class ConfirmationLifecycle {

    public static final int DEFAULT_EXPIRY_HOURS = 24;
    public static final int MIN_EXPIRY_HOURS = 1;
    public static final int MAX_EXPIRY_HOURS = 24 * 365;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final int DEFAULT_LOCKOUT_MINUTES = 60;

    private final RevocationConfirmationRepository repository;
    private final CodeHasher codeHasher;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration lockoutDuration;

    public ConfirmationLifecycle(
            RevocationConfirmationRepository repository,
            CodeHasher codeHasher,
            Clock clock,
            @Value("${app.revocation.max-attempts:5}") int maxAttempts,
            @Value("${app.revocation.lockout-minutes:60}") int lockoutMinutes) {
        this.repository = repository;
        this.codeHasher = codeHasher;
        this.clock = clock;
        this.maxAttempts = SettingsBounds.bounded("app.revocation.max-attempts",
                maxAttempts, DEFAULT_MAX_ATTEMPTS, 1, 20);
        this.lockoutDuration = Duration.ofMinutes(SettingsBounds.bounded("app.revocation.lockout-minutes",
                lockoutMinutes, DEFAULT_LOCKOUT_MINUTES, 1, 24 * 60));
    }

    /**
     * Creates a pending confirmation. A concurrent create for the same target fails on the
     * partial unique index with a {@code DataIntegrityViolationException}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IssuedConfirmation create(UUID targetId, UUID requesterId, String reason, Integer expiryHours) {
        String code = codeHasher.generateToken();
        Instant now = clock.instant();

        RevocationConfirmation confirmation = RevocationConfirmation.builder()
                .targetId(targetId)
                .requesterId(requesterId)
                .codeHash(codeHasher.hash(code))
                .status(RevocationStatus.PENDING)
                .reason(reason)
                .expiresAt(now.plus(Duration.ofHours(clampExpiryHours(expiryHours))))
                .attemptCount(0)
                .createdAt(now)
                .build();

        RevocationConfirmation saved = repository.saveAndFlush(confirmation);
        log.info("Revocation confirmation created: id={}, expiresAt={}", saved.getId(), saved.getExpiresAt());
        return new IssuedConfirmation(saved, code);
    }

    /**
     * Checks a candidate code without consuming it. A correct code leaves the record pending;
     * only {@link #confirm} moves it on. Checks run in the order lock, expiry, status, code.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VerificationResult verify(UUID id, String candidateCode) {
        Optional<RevocationConfirmation> found = repository.findById(id);
        if (found.isEmpty()) {
            return VerificationResult.notFound();
        }
        RevocationConfirmation confirmation = found.get();
        Instant now = clock.instant();

        if (confirmation.isLockedAt(now)) {
            return VerificationResult.of(Outcome.LOCKED, confirmation);
        }

        if (confirmation.isPending() && confirmation.isExpiredAt(now)) {
            if (repository.transitionStatus(id, RevocationStatus.PENDING, RevocationStatus.EXPIRED) == 1) {
                log.info("Revocation confirmation expired on access: id={}", id);
            }
            return VerificationResult.of(Outcome.EXPIRED, reload(id, confirmation));
        }

        if (confirmation.getStatus() == RevocationStatus.EXPIRED) {
            return VerificationResult.of(Outcome.EXPIRED, confirmation);
        }
        if (!confirmation.isPending()) {
            return VerificationResult.of(Outcome.NOT_PENDING, confirmation);
        }

        if (codeHasher.verify(candidateCode, confirmation.getCodeHash())) {
            return VerificationResult.of(Outcome.VALID, confirmation);
        }

        repository.incrementAttemptCount(id);
        boolean lockedNow = repository.lockIfAttemptsReached(id, maxAttempts, now.plus(lockoutDuration)) == 1;
        RevocationConfirmation updated = reload(id, confirmation);
        if (lockedNow) {
            log.warn("Revocation confirmation locked after {} failed attempts: id={}", updated.getAttemptCount(), id);
            return VerificationResult.of(Outcome.LOCKED, updated);
        }
        log.info("Invalid confirmation code: id={}, attempts={}", id, updated.getAttemptCount());
        return VerificationResult.of(Outcome.INVALID_CODE, updated);
    }

    /**
     * @return true when this call moved the record from PENDING to CONFIRMED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean confirm(UUID id, String confirmerId) {
        return repository.markConfirmed(id, clock.instant(), confirmerId) == 1;
    }

    /**
     * @return true when this call moved the record from PENDING to CANCELLED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean cancel(UUID id, String cancellerId) {
        boolean cancelled = repository.transitionStatus(id, RevocationStatus.PENDING, RevocationStatus.CANCELLED) == 1;
        if (cancelled) {
            log.info("Revocation confirmation cancelled: id={}, by={}", id, cancellerId);
        }
        return cancelled;
    }

    @Transactional(readOnly = true)
    public Optional<RevocationConfirmation> findById(UUID id) {
        return repository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<RevocationConfirmation> findPendingForTarget(UUID targetId) {
        return repository.findFirstByTargetIdAndStatusOrderByCreatedAtDesc(targetId, RevocationStatus.PENDING);
    }

    /**
     * Pending confirmation for the target that is still inside its window. A stale pending
     * record is expired on the way, so it no longer blocks a new request.
     */
    @Transactional
    public Optional<RevocationConfirmation> findActivePendingForTarget(UUID targetId) {
        Optional<RevocationConfirmation> pending = findPendingForTarget(targetId);
        if (pending.isPresent() && pending.get().isExpiredAt(clock.instant())) {
            repository.transitionStatus(pending.get().getId(), RevocationStatus.PENDING, RevocationStatus.EXPIRED);
            log.info("Revocation confirmation expired on access: id={}", pending.get().getId());
            return Optional.empty();
        }
        return pending;
    }

    @Transactional(readOnly = true)
    public Optional<RevocationConfirmation> findLatestConfirmedForTarget(UUID targetId) {
        return repository.findFirstByTargetIdAndStatusOrderByCreatedAtDesc(targetId, RevocationStatus.CONFIRMED);
    }

    public int attemptsRemaining(RevocationConfirmation confirmation) {
        return Math.max(0, maxAttempts - confirmation.getAttemptCount());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getLockoutDuration() {
        return lockoutDuration;
    }

    static int clampExpiryHours(Integer requested) {
        int hours = requested == null ? DEFAULT_EXPIRY_HOURS : requested;
        return Math.min(Math.max(hours, MIN_EXPIRY_HOURS), MAX_EXPIRY_HOURS);
    }

    private RevocationConfirmation reload(UUID id, RevocationConfirmation fallback) {
        return repository.findById(id).orElse(fallback);
    }
}
