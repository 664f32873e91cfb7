package com.securenotify.keysvc.api.controller;

import com.securenotify.keysvc.api.dto.request.ConfirmRevocationRequest;
import com.securenotify.keysvc.api.dto.request.RevocationRequest;
import com.securenotify.keysvc.api.dto.response.RevocationConfirmedResponse;
import com.securenotify.keysvc.api.dto.response.RevocationRequestedResponse;
import com.securenotify.keysvc.api.dto.response.RevocationStatusResponse;
import com.securenotify.keysvc.domain.model.RevocationStatus;
import com.securenotify.keysvc.domain.revocation.RevocationWorkflow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Key Revocation", description = "Two-phase public key revocation")
@SecurityRequirement(name = "api-key")
public class RevocationController {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final RevocationWorkflow revocationWorkflow;

    @PostMapping("/keys/{keyId}/revoke")
    @Operation(summary = "Request revocation",
            description = "Opens a revocation and returns a one-time confirmation code. The code is shown only once.")
    @ApiResponse(responseCode = "201", description = "Revocation pending confirmation")
    @ApiResponse(responseCode = "400", description = "Invalid reason or confirmation window")
    @ApiResponse(responseCode = "401", description = "Missing or invalid API key")
    @ApiResponse(responseCode = "403", description = "Missing key_revoke permission")
    @ApiResponse(responseCode = "404", description = "Key not found")
    @ApiResponse(responseCode = "409", description = "Key already revoked or revocation pending")
    public ResponseEntity<RevocationRequestedResponse> requestRevocation(
            @PathVariable UUID keyId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @RequestBody RevocationRequest request) {

        log.info("Processing revocation request for key {}", keyId);
        var ticket = revocationWorkflow.requestRevocation(keyId, apiKey, request.reason(), request.confirmationHours());

        return ResponseEntity.status(HttpStatus.CREATED).body(new RevocationRequestedResponse(
                ticket.revocationId(),
                ticket.keyId(),
                RevocationStatus.PENDING,
                ticket.expiresAt(),
                ticket.confirmationCode(),
                "Confirm the revocation with the code before it expires"
        ));
    }

    @GetMapping("/keys/{keyId}/revocation")
    @Operation(summary = "Get pending revocation", description = "Returns the pending revocation for a key")
    @ApiResponse(responseCode = "200", description = "Pending revocation found")
    @ApiResponse(responseCode = "404", description = "Key not found or nothing pending")
    public ResponseEntity<RevocationStatusResponse> getPendingForKey(
            @PathVariable UUID keyId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return ResponseEntity.ok(RevocationStatusResponse.from(revocationWorkflow.getPendingForKey(keyId, apiKey)));
    }

    @PostMapping("/revocations/{revocationId}/confirm")
    @Operation(summary = "Confirm revocation", description = "Verifies the code and revokes the key")
    @ApiResponse(responseCode = "200", description = "Key revoked")
    @ApiResponse(responseCode = "400", description = "Invalid confirmation code")
    @ApiResponse(responseCode = "409", description = "Revocation no longer pending")
    @ApiResponse(responseCode = "410", description = "Revocation expired")
    @ApiResponse(responseCode = "423", description = "Too many failed attempts")
    public ResponseEntity<RevocationConfirmedResponse> confirm(
            @PathVariable UUID revocationId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody ConfirmRevocationRequest request) {

        log.info("Processing revocation confirmation {}", revocationId);
        var outcome = revocationWorkflow.confirmRevocation(revocationId, request.confirmationCode(), apiKey);

        return ResponseEntity.ok(new RevocationConfirmedResponse(
                outcome.revocationId(),
                outcome.deletedKeyId(),
                outcome.channelId(),
                outcome.revokedAt()
        ));
    }

    @PostMapping("/revocations/{revocationId}/cancel")
    @Operation(summary = "Cancel revocation")
    @ApiResponse(responseCode = "200", description = "Revocation cancelled")
    @ApiResponse(responseCode = "409", description = "Revocation no longer pending")
    public ResponseEntity<RevocationStatusResponse> cancel(
            @PathVariable UUID revocationId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {

        log.info("Processing revocation cancellation {}", revocationId);
        return ResponseEntity.ok(RevocationStatusResponse.from(revocationWorkflow.cancelRevocation(revocationId, apiKey)));
    }

    @GetMapping("/revocations/{revocationId}")
    @Operation(summary = "Get revocation status")
    @ApiResponse(responseCode = "200", description = "Revocation found")
    @ApiResponse(responseCode = "404", description = "Revocation not found")
    public ResponseEntity<RevocationStatusResponse> getStatus(
            @PathVariable UUID revocationId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return ResponseEntity.ok(RevocationStatusResponse.from(revocationWorkflow.getStatus(revocationId, apiKey)));
    }
}
