package com.securenotify.keysvc.shared.exception;

public final class ExpiredException extends KeyServiceException {

    public ExpiredException() {
        super("Revocation confirmation has expired");
    }

    @Override
    public String getErrorCode() {
        return "EXPIRED";
    }

    @Override
    public int getHttpStatus() {
        return 410;
    }
}
