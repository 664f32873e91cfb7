package com.securenotify.keysvc.shared.exception;

import java.util.Map;

public final class InvalidCodeException extends KeyServiceException {

    private final int attemptsRemaining;

    public InvalidCodeException(int attemptsRemaining) {
        super("Invalid confirmation code");
        this.attemptsRemaining = attemptsRemaining;
    }

    public int getAttemptsRemaining() {
        return attemptsRemaining;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_CODE";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return Map.of("attemptsRemaining", attemptsRemaining);
    }
}
