package com.securenotify.keysvc.domain.credential;

public final class Permissions {

    public static final String ADMIN = "admin";
    public static final String KEY_REVOKE = "key_revoke";

    private Permissions() {
    }
}
