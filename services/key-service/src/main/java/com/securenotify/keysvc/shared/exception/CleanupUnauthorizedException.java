package com.securenotify.keysvc.shared.exception;

public final class CleanupUnauthorizedException extends KeyServiceException {

    public CleanupUnauthorizedException() {
        super("Cleanup trigger rejected");
    }

    @Override
    public String getErrorCode() {
        return "CLEANUP_UNAUTHORIZED";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}
