package com.securenotify.keysvc.shared.exception;

public final class AuthRequiredException extends KeyServiceException {

    public AuthRequiredException() {
        super("API key required");
    }

    @Override
    public String getErrorCode() {
        return "AUTH_REQUIRED";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}
