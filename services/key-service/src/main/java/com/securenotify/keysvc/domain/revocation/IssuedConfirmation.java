package com.securenotify.keysvc.domain.revocation;

import com.securenotify.keysvc.domain.model.RevocationConfirmation;

/**
 * A freshly created confirmation together with its plaintext code.
 * The code exists only here; the stored record holds its hash.
 */
public record IssuedConfirmation(RevocationConfirmation confirmation, String plaintextCode) {

    @Override
    public String toString() {
        return "IssuedConfirmation[id=" + confirmation.getId() + "]";
    }
}
