package com.securenotify.keysvc.shared.exception;

public final class AuthFailedException extends KeyServiceException {

    public AuthFailedException() {
        super("Invalid API key");
    }

    @Override
    public String getErrorCode() {
        return "AUTH_FAILED";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}
