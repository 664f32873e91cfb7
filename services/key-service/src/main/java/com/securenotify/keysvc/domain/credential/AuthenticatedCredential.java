package com.securenotify.keysvc.domain.credential;

import java.util.Set;
import java.util.UUID;

/**
 * A caller whose API key has been checked. The raw key is never kept.
 */
public record AuthenticatedCredential(UUID apiKeyId, String userId, Set<String> permissions) {

    public AuthenticatedCredential {
        permissions = Set.copyOf(permissions);
    }

    public boolean isAdmin() {
        return permissions.contains(Permissions.ADMIN);
    }

    public boolean has(String permission) {
        return isAdmin() || permissions.contains(permission);
    }
}
