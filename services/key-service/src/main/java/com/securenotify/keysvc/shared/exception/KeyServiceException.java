package com.securenotify.keysvc.shared.exception;

import java.util.Map;

/**
 * Base sealed exception for all key-service business failures.
 */
public sealed abstract class KeyServiceException extends RuntimeException
        permits AuthRequiredException, AuthFailedException, PermissionDeniedException,
                ValidationException, NotFoundException, AlreadyRevokedException,
                RevocationPendingException, InvalidCodeException, InvalidStateException,
                LockedException, ExpiredException, RateLimitedException,
                CleanupUnauthorizedException {

    protected KeyServiceException(String message) {
        super(message);
    }

    protected KeyServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
    public abstract int getHttpStatus();

    /**
     * Extra problem-detail members exposed to the caller.
     */
    public Map<String, Object> getExtensions() {
        return Map.of();
    }
}
