package com.securenotify.keysvc.infrastructure.persistence;

import com.securenotify.keysvc.domain.model.RevocationConfirmation;
import com.securenotify.keysvc.domain.model.RevocationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every mutation is a conditional update scoped by id and current status, so concurrent
 * callers never overwrite each other's transitions.
 */
@Repository
public interface RevocationConfirmationRepository extends JpaRepository<RevocationConfirmation, UUID> {

    Optional<RevocationConfirmation> findFirstByTargetIdAndStatusOrderByCreatedAtDesc(
            UUID targetId, RevocationStatus status);

    long countByStatus(RevocationStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RevocationConfirmation c SET c.attemptCount = c.attemptCount + 1 " +
            "WHERE c.id = :id AND c.status = com.securenotify.keysvc.domain.model.RevocationStatus.PENDING")
    int incrementAttemptCount(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RevocationConfirmation c SET c.lockedUntil = :lockedUntil " +
            "WHERE c.id = :id AND c.attemptCount >= :maxAttempts " +
            "AND c.status = com.securenotify.keysvc.domain.model.RevocationStatus.PENDING")
    int lockIfAttemptsReached(@Param("id") UUID id,
                              @Param("maxAttempts") int maxAttempts,
                              @Param("lockedUntil") Instant lockedUntil);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RevocationConfirmation c SET c.status = :to WHERE c.id = :id AND c.status = :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") RevocationStatus from,
                         @Param("to") RevocationStatus to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RevocationConfirmation c SET c.status = com.securenotify.keysvc.domain.model.RevocationStatus.CONFIRMED, " +
            "c.confirmedAt = :confirmedAt, c.confirmedBy = :confirmedBy " +
            "WHERE c.id = :id AND c.status = com.securenotify.keysvc.domain.model.RevocationStatus.PENDING")
    int markConfirmed(@Param("id") UUID id,
                      @Param("confirmedAt") Instant confirmedAt,
                      @Param("confirmedBy") String confirmedBy);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RevocationConfirmation c SET c.status = com.securenotify.keysvc.domain.model.RevocationStatus.EXPIRED " +
            "WHERE c.status = com.securenotify.keysvc.domain.model.RevocationStatus.PENDING AND c.expiresAt < :now")
    int expireAllPendingBefore(@Param("now") Instant now);

    @Query("SELECT c.id FROM RevocationConfirmation c " +
            "WHERE c.status = com.securenotify.keysvc.domain.model.RevocationStatus.EXPIRED AND c.expiresAt < :cutoff")
    List<UUID> findExpiredIdsBefore(@Param("cutoff") Instant cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RevocationConfirmation c WHERE c.id IN :ids " +
            "AND c.status = com.securenotify.keysvc.domain.model.RevocationStatus.EXPIRED")
    int deleteExpiredByIds(@Param("ids") Collection<UUID> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RevocationConfirmation c WHERE c.targetId IN :targetIds")
    int deleteByTargetIds(@Param("targetIds") Collection<UUID> targetIds);
}
