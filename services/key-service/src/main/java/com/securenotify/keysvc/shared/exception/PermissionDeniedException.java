package com.securenotify.keysvc.shared.exception;

import java.util.Map;

public final class PermissionDeniedException extends KeyServiceException {

    private final String requiredPermission;

    public PermissionDeniedException(String requiredPermission) {
        super("Insufficient permissions for key revocation");
        this.requiredPermission = requiredPermission;
    }

    public String getRequiredPermission() {
        return requiredPermission;
    }

    @Override
    public String getErrorCode() {
        return "PERMISSION_DENIED";
    }

    @Override
    public int getHttpStatus() {
        return 403;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return Map.of("required", requiredPermission);
    }
}
