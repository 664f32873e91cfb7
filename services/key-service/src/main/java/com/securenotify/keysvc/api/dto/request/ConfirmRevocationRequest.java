package com.securenotify.keysvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ConfirmRevocationRequest(
    @NotBlank(message = "Confirmation code is required")
    @Size(max = 128, message = "Invalid confirmation code format")
    String confirmationCode
) {
    @Override
    public String toString() {
        return "ConfirmRevocationRequest[confirmationCode=***]";
    }
}
