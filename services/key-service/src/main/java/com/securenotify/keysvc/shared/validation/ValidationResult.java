package com.securenotify.keysvc.shared.validation;

import com.securenotify.keysvc.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking revocation input. Results from several checks are combined with {@link #and}.
 */
public record ValidationResult(boolean valid, List<FieldError> errors) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(List<FieldError> errors) {
        return errors.isEmpty() ? SUCCESS : new ValidationResult(false, errors);
    }

    public static ValidationResult failure(FieldError error) {
        return new ValidationResult(false, List.of(error));
    }

    public ValidationResult and(ValidationResult other) {
        if (other.valid) {
            return this;
        }
        if (valid) {
            return other;
        }
        List<FieldError> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new ValidationResult(false, merged);
    }

    public boolean hasErrorFor(String field) {
        return errors.stream().anyMatch(e -> e.field().equals(field));
    }

    public void throwIfInvalid() {
        if (!valid) {
            throw new ValidationException(errors);
        }
    }
}
