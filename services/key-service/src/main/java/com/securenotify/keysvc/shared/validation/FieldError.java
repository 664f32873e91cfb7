package com.securenotify.keysvc.shared.validation;

/**
 * A single rejected input field. {@code code} is stable and machine-readable, {@code message} is for humans.
 * Rejected values are never carried, since they may hold confirmation codes or key material.
 */
public record FieldError(String field, String code, String message) {

    public static FieldError of(String field, String code, String message) {
        return new FieldError(field, code, message);
    }

    public static FieldError required(String field, String label) {
        return new FieldError(field, "REQUIRED", label + " is required");
    }

    public static FieldError outOfRange(String field, String label, int min, int max) {
        return new FieldError(field, "OUT_OF_RANGE", label + " must be between " + min + " and " + max);
    }
}
