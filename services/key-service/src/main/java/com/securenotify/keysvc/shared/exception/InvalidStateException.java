package com.securenotify.keysvc.shared.exception;

public final class InvalidStateException extends KeyServiceException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_STATE";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
