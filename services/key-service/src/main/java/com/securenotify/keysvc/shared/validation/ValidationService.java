package com.securenotify.keysvc.shared.validation;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized validation for revocation input.
 */
@Service
public class ValidationService {

    public static final int REASON_MIN_LENGTH = 10;
    public static final int REASON_MAX_LENGTH = 1000;
    public static final int MIN_EXPIRY_HOURS = 1;
    public static final int MAX_EXPIRY_HOURS = 24 * 365;

    /**
     * Validates a revocation reason: trimmed length 10-1000, no control characters
     * other than tab, line feed and carriage return, no unpaired surrogates.
     */
    public ValidationResult validateReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return ValidationResult.failure(FieldError.required("reason", "Reason"));
        }

        String trimmed = reason.trim();
        List<FieldError> errors = new ArrayList<>();

        if (trimmed.length() < REASON_MIN_LENGTH) {
            errors.add(FieldError.of("reason", "TOO_SHORT",
                    "Reason must be at least " + REASON_MIN_LENGTH + " characters"));
        }

        if (trimmed.length() > REASON_MAX_LENGTH) {
            errors.add(FieldError.of("reason", "TOO_LONG",
                    "Reason must not exceed " + REASON_MAX_LENGTH + " characters"));
        }

        if (containsInvalidCharacters(reason)) {
            errors.add(FieldError.of("reason", "INVALID_CHARACTERS",
                    "Reason contains control characters or invalid encoding"));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Validates the requested confirmation window. A missing value is accepted and defaulted later.
     */
    public ValidationResult validateExpiryHours(Integer expiryHours) {
        if (expiryHours == null) {
            return ValidationResult.success();
        }
        if (expiryHours < MIN_EXPIRY_HOURS || expiryHours > MAX_EXPIRY_HOURS) {
            return ValidationResult.failure(FieldError.outOfRange("confirmationHours", "Confirmation hours",
                    MIN_EXPIRY_HOURS, MAX_EXPIRY_HOURS));
        }
        return ValidationResult.success();
    }

    /**
     * Validates complete revocation request.
     */
    public ValidationResult validateRevocationRequest(String reason, Integer expiryHours) {
        return validateReason(reason).and(validateExpiryHours(expiryHours));
    }

    public String normalizeReason(String reason) {
        if (reason == null) return null;
        return reason.trim();
    }

    public boolean containsInvalidCharacters(String value) {
        if (value == null) return true;

        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 32 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1))) {
                    return true;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return true;
            }
        }
        return false;
    }
}
