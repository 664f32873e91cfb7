package com.securenotify.keysvc.shared.exception;

import com.securenotify.keysvc.shared.validation.FieldError;

import java.util.List;
import java.util.Map;

public final class ValidationException extends KeyServiceException {

    private final List<FieldError> errors;

    public ValidationException(List<FieldError> errors) {
        super("Validation failed");
        this.errors = List.copyOf(errors);
    }

    public ValidationException(FieldError error) {
        this(List.of(error));
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return Map.of("errors", errors);
    }
}
