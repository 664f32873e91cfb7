package com.securenotify.keysvc.domain.revocation;

import com.securenotify.keysvc.domain.model.RevocationConfirmation;

/**
 * Result of checking a candidate code. {@code confirmation} reflects the stored state after
 * any attempt counting, and is null only for {@link Outcome#NOT_FOUND}.
 */
public record VerificationResult(Outcome outcome, RevocationConfirmation confirmation) {

    public enum Outcome {
        VALID,
        INVALID_CODE,
        LOCKED,
        EXPIRED,
        NOT_PENDING,
        NOT_FOUND
    }

    public static VerificationResult of(Outcome outcome, RevocationConfirmation confirmation) {
        return new VerificationResult(outcome, confirmation);
    }

    public static VerificationResult notFound() {
        return new VerificationResult(Outcome.NOT_FOUND, null);
    }

    public boolean valid() {
        return outcome == Outcome.VALID;
    }

    public boolean locked() {
        return outcome == Outcome.LOCKED;
    }
}
