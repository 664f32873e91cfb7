package com.securenotify.keysvc.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A subscriber's registered public key. Revocation soft-deletes it; the cleanup sweep removes it later.
 */
@Entity
@Table(name = "public_keys")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublicKey {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "channel_id", nullable = false, unique = true, length = 64)
    private String channelId;

    @Column(name = "public_key", nullable = false, columnDefinition = "text")
    private String publicKey;

    @Column(name = "algorithm", nullable = false, length = 50)
    private String algorithm;

    @Column(name = "owner_id")
    private String ownerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_by")
    private String revokedBy;

    @Column(name = "revocation_reason", columnDefinition = "text")
    private String revocationReason;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (algorithm == null) {
            algorithm = "RSA-2048";
        }
    }

    /**
     * Key state captured for the audit trail. The key material itself is left out.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", String.valueOf(id));
        snapshot.put("channelId", channelId);
        snapshot.put("algorithm", algorithm);
        snapshot.put("ownerId", ownerId);
        snapshot.put("createdAt", String.valueOf(createdAt));
        snapshot.put("expiresAt", expiresAt == null ? null : expiresAt.toString());
        snapshot.put("lastUsedAt", lastUsedAt == null ? null : lastUsedAt.toString());
        snapshot.put("deleted", deleted);
        return snapshot;
    }
}
