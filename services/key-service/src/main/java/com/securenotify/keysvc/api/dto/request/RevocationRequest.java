package com.securenotify.keysvc.api.dto.request;

/**
 * Reason and window are checked by the domain validator so every rule reports the same error shape.
 */
public record RevocationRequest(
    String reason,
    Integer confirmationHours
) {}
