package com.securenotify.keysvc.domain.credential;

import com.securenotify.keysvc.domain.model.ApiKey;
import com.securenotify.keysvc.infrastructure.logging.AuditAction;
import com.securenotify.keysvc.infrastructure.logging.AuditEvent;
import com.securenotify.keysvc.infrastructure.logging.AuditLogger;
import com.securenotify.keysvc.infrastructure.persistence.ApiKeyRepository;
import com.securenotify.keysvc.shared.crypto.CodeHasher;
import com.securenotify.keysvc.shared.exception.AuthFailedException;
import com.securenotify.keysvc.shared.exception.AuthRequiredException;
import com.securenotify.keysvc.shared.exception.PermissionDeniedException;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves raw API keys to credentials. Keys are looked up by their SHA-256 digest.
 */
@Service
@Slf4j
public class CredentialService {

    public static final int MIN_KEY_LENGTH = 16;

    private final ApiKeyRepository apiKeyRepository;
    private final CodeHasher codeHasher;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    public CredentialService(ApiKeyRepository apiKeyRepository,
                             CodeHasher codeHasher,
                             AuditLogger auditLogger,
                             SecurityUtils securityUtils,
                             Clock clock) {
        this.apiKeyRepository = apiKeyRepository;
        this.codeHasher = codeHasher;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.clock = clock;
    }

    /**
     * @throws AuthRequiredException when no key was presented
     * @throws AuthFailedException when the key is malformed, unknown, inactive, revoked or expired
     */
    @Transactional(readOnly = true)
    public AuthenticatedCredential authenticate(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new AuthRequiredException();
        }
        String trimmed = rawApiKey.trim();
        if (trimmed.length() < MIN_KEY_LENGTH) {
            throw rejected("malformed", null);
        }

        ApiKey apiKey = apiKeyRepository.findByKeyHash(codeHasher.sha256Hex(trimmed))
                .orElseThrow(() -> rejected("unknown", null));
        Instant now = clock.instant();
        if (!apiKey.isActive()) {
            throw rejected("inactive", apiKey);
        }
        if (apiKey.isDeleted()) {
            throw rejected("revoked", apiKey);
        }
        if (apiKey.isExpiredAt(now)) {
            throw rejected("expired", apiKey);
        }

        return new AuthenticatedCredential(apiKey.getId(), apiKey.getUserId(), apiKey.permissionSet());
    }

    /**
     * @throws PermissionDeniedException unless the credential carries the permission or is admin
     */
    public void requirePermission(AuthenticatedCredential credential, String permission) {
        if (!credential.has(permission)) {
            auditLogger.logAudit(AuditEvent.failure(AuditAction.PERMISSION_DENIED, credential.userId(), null,
                    securityUtils.getCurrentCorrelationId(), "Missing permission",
                    Map.of("required", permission)));
            throw new PermissionDeniedException(permission);
        }
    }

    private AuthFailedException rejected(String reason, ApiKey apiKey) {
        log.warn("API key rejected: reason={}", reason);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason);
        if (apiKey != null) {
            metadata.put("keyPrefix", apiKey.getKeyPrefix());
        }
        auditLogger.logAudit(AuditEvent.failure(AuditAction.AUTH_FAILURE,
                apiKey == null ? null : apiKey.getUserId(), null,
                securityUtils.getCurrentCorrelationId(), "API key rejected", metadata));
        return new AuthFailedException();
    }
}
