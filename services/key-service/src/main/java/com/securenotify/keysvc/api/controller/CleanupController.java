package com.securenotify.keysvc.api.controller;

import com.securenotify.keysvc.api.dto.response.CleanupResponse;
import com.securenotify.keysvc.api.dto.response.CleanupStatusResponse;
import com.securenotify.keysvc.domain.cleanup.CleanupService;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/admin/cleanup")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cleanup", description = "Expiry and hard-delete sweep")
public class CleanupController {

    public static final String CLEANUP_SECRET_HEADER = "X-Cleanup-Secret";

    private final CleanupService cleanupService;
    private final SecurityUtils securityUtils;

    @PostMapping
    @Operation(summary = "Run cleanup", description = "Expires overdue confirmations and purges revoked keys")
    @ApiResponse(responseCode = "200", description = "Cleanup finished; failed batches are listed in errors")
    @ApiResponse(responseCode = "401", description = "Secret rejected")
    public ResponseEntity<CleanupResponse> trigger(
            @RequestHeader(value = CLEANUP_SECRET_HEADER, required = false) String secret,
            HttpServletRequest request) {

        log.info("Processing cleanup trigger");
        var report = cleanupService.trigger(secret, clientIp(request));
        return ResponseEntity.ok(CleanupResponse.from(report));
    }

    @GetMapping("/status")
    @Operation(summary = "Cleanup status", description = "Counts of pending confirmations and revoked keys")
    public ResponseEntity<CleanupStatusResponse> status(
            @RequestHeader(value = CLEANUP_SECRET_HEADER, required = false) String secret,
            HttpServletRequest request) {

        var status = cleanupService.status(secret, clientIp(request));
        return ResponseEntity.ok(new CleanupStatusResponse(
                status.pendingConfirmations(),
                status.revokedKeys(),
                status.purgeableKeys(),
                status.retentionDays()
        ));
    }

    private String clientIp(HttpServletRequest request) {
        return securityUtils.resolveClientIp(
                request.getHeader("X-Forwarded-For"), request.getHeader("X-Real-IP"), request.getRemoteAddr());
    }
}
