package com.securenotify.keysvc.infrastructure.persistence;

import com.securenotify.keysvc.domain.model.PublicKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface PublicKeyRepository extends JpaRepository<PublicKey, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PublicKey k SET k.deleted = true, k.revokedAt = :revokedAt, k.revokedBy = :revokedBy, " +
            "k.revocationReason = :reason WHERE k.id = :id AND k.deleted = false")
    int softDelete(@Param("id") UUID id,
                   @Param("revokedAt") Instant revokedAt,
                   @Param("revokedBy") String revokedBy,
                   @Param("reason") String reason);

    @Query("SELECT k.id FROM PublicKey k WHERE k.deleted = true AND k.revokedAt IS NOT NULL AND k.revokedAt < :cutoff")
    List<UUID> findRevokedIdsBefore(@Param("cutoff") Instant cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PublicKey k WHERE k.id IN :ids AND k.deleted = true")
    int deleteRevokedByIds(@Param("ids") Collection<UUID> ids);

    long countByDeletedTrue();

    @Query("SELECT COUNT(k) FROM PublicKey k WHERE k.deleted = true AND k.revokedAt IS NOT NULL AND k.revokedAt < :cutoff")
    long countRevokedBefore(@Param("cutoff") Instant cutoff);
}
