package com.securenotify.keysvc.domain.revocation;

import com.securenotify.keysvc.domain.credential.AuthenticatedCredential;
import com.securenotify.keysvc.domain.credential.CredentialService;
import com.securenotify.keysvc.domain.credential.Permissions;
import com.securenotify.keysvc.domain.model.PublicKey;
import com.securenotify.keysvc.domain.model.RevocationStatus;
import com.securenotify.keysvc.infrastructure.logging.AuditAction;
import com.securenotify.keysvc.infrastructure.logging.AuditEvent;
import com.securenotify.keysvc.infrastructure.logging.AuditLogger;
import com.securenotify.keysvc.infrastructure.outbox.OutboxPublisher;
import com.securenotify.keysvc.infrastructure.persistence.PublicKeyRepository;
import com.securenotify.keysvc.shared.crypto.CodeHasher;
import com.securenotify.keysvc.shared.exception.AlreadyRevokedException;
import com.securenotify.keysvc.shared.exception.AuthRequiredException;
import com.securenotify.keysvc.shared.exception.ExpiredException;
import com.securenotify.keysvc.shared.exception.InvalidCodeException;
import com.securenotify.keysvc.shared.exception.InvalidStateException;
import com.securenotify.keysvc.shared.exception.LockedException;
import com.securenotify.keysvc.shared.exception.NotFoundException;
import com.securenotify.keysvc.shared.exception.PermissionDeniedException;
import com.securenotify.keysvc.shared.exception.RevocationPendingException;
import com.securenotify.keysvc.shared.exception.ValidationException;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import com.securenotify.keysvc.shared.validation.ValidationService;
import com.securenotify.keysvc.support.InMemoryConfirmationStore;
import com.securenotify.keysvc.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RevocationWorkflowTest {

    private static final String RAW_KEY = "sk_test_0123456789abcdef";
    private static final String REASON = "Private key copied to an untrusted laptop";

    private MutableClock clock;
    private InMemoryConfirmationStore store;
    private PublicKeyRepository publicKeyRepository;
    private CredentialService credentialService;
    private OutboxPublisher outboxPublisher;
    private AuditLogger auditLogger;
    private RevocationWorkflow workflow;

    private PublicKey key;
    private AuthenticatedCredential owner;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        store = new InMemoryConfirmationStore();
        publicKeyRepository = mock(PublicKeyRepository.class);
        credentialService = mock(CredentialService.class);
        outboxPublisher = mock(OutboxPublisher.class);
        auditLogger = mock(AuditLogger.class);

        ConfirmationLifecycle lifecycle =
                new ConfirmationLifecycle(store.repository(), new CodeHasher(100_000), clock, 5, 60);
        workflow = new RevocationWorkflow(lifecycle, publicKeyRepository, credentialService,
                new ValidationService(), outboxPublisher, auditLogger, new SecurityUtils(),
                new TransactionTemplate(mock(PlatformTransactionManager.class)), clock);

        key = PublicKey.builder()
                .id(UUID.randomUUID())
                .channelId("channel-alpha")
                .publicKey("-----BEGIN PUBLIC KEY-----")
                .algorithm("RSA-2048")
                .ownerId("user-1")
                .createdAt(clock.instant().minus(Duration.ofDays(10)))
                .build();
        owner = new AuthenticatedCredential(UUID.randomUUID(), "user-1", Set.of(Permissions.KEY_REVOKE));

        when(credentialService.authenticate(RAW_KEY)).thenReturn(owner);
        when(publicKeyRepository.findById(key.getId())).thenReturn(Optional.of(key));
        when(publicKeyRepository.softDelete(eq(key.getId()), any(), anyString(), anyString())).thenAnswer(inv -> {
            if (key.isDeleted()) {
                return 0;
            }
            key.setDeleted(true);
            key.setRevokedAt(inv.getArgument(1));
            key.setRevokedBy(inv.getArgument(2));
            return 1;
        });
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Request issues a one-time code and audits without the code")
    void requestIssuesTicket() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, "  " + REASON + "  ", null);

        assertThat(ticket.keyId()).isEqualTo(key.getId());
        assertThat(ticket.confirmationCode()).matches("[0-9a-f]{64}");
        assertThat(ticket.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(store.get(ticket.revocationId()).getReason()).isEqualTo(REASON);

        ArgumentCaptor<AuditEvent> audit = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditLogger).logAudit(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(AuditAction.KEY_REVOKE_REQUEST);
        assertThat(audit.getValue().metadata().toString()).doesNotContain(ticket.confirmationCode());
    }

    @Test
    @DisplayName("A repeated request surfaces the existing pending confirmation")
    void repeatedRequestIsIdempotent() {
        RevocationTicket first = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);

        assertThatThrownBy(() -> workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null))
                .isInstanceOfSatisfying(RevocationPendingException.class,
                        e -> assertThat(e.getRevocationId()).isEqualTo(first.revocationId()));
        assertThat(store.all()).hasSize(1);
    }

    @Test
    @DisplayName("Missing permission stops the request before any write")
    void permissionDeniedHasNoEffect() {
        doThrow(new PermissionDeniedException(Permissions.KEY_REVOKE))
                .when(credentialService).requirePermission(owner, Permissions.KEY_REVOKE);

        assertThatThrownBy(() -> workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(store.all()).isEmpty();
        verify(publicKeyRepository, never()).findById(any());
    }

    @Test
    @DisplayName("Missing API key is rejected")
    void missingKeyRejected() {
        when(credentialService.authenticate(null)).thenThrow(new AuthRequiredException());

        assertThatThrownBy(() -> workflow.requestRevocation(key.getId(), null, REASON, null))
                .isInstanceOf(AuthRequiredException.class);
        assertThat(store.all()).isEmpty();
    }

    @Test
    @DisplayName("Invalid input stops the request before the key lookup")
    void invalidInputHasNoEffect() {
        assertThatThrownBy(() -> workflow.requestRevocation(key.getId(), RAW_KEY, "short", 0))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getErrors()).hasSize(2));
        assertThat(store.all()).isEmpty();
        verify(publicKeyRepository, never()).findById(any());
    }

    @Test
    @DisplayName("A caller may not revoke another owner's key")
    void foreignKeyIsDenied() {
        key.setOwnerId("user-2");

        assertThatThrownBy(() -> workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(store.all()).isEmpty();
    }

    @Test
    @DisplayName("Unknown keys are reported as not found")
    void unknownKey() {
        UUID missing = UUID.randomUUID();
        when(publicKeyRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> workflow.requestRevocation(missing, RAW_KEY, REASON, null))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Confirming with the right code soft-deletes the key and publishes an event")
    void confirmRevokesKey() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);
        clock.advance(Duration.ofMinutes(5));

        RevocationOutcome outcome = workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY);

        assertThat(outcome.deletedKeyId()).isEqualTo(key.getId());
        assertThat(outcome.channelId()).isEqualTo("channel-alpha");
        assertThat(outcome.revokedAt()).isEqualTo(clock.instant());
        assertThat(key.isDeleted()).isTrue();
        assertThat(store.get(ticket.revocationId()).getStatus()).isEqualTo(RevocationStatus.CONFIRMED);
        verify(outboxPublisher).publish(eq("PublicKey"), eq(key.getId()),
                eq(RevocationWorkflow.EVENT_KEY_REVOKED), anyMap());

        ArgumentCaptor<AuditEvent> audit = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditLogger, atLeastOnce()).logAudit(audit.capture());
        AuditEvent confirmed = audit.getAllValues().get(audit.getAllValues().size() - 1);
        assertThat(confirmed.action()).isEqualTo(AuditAction.KEY_REVOKE_CONFIRMED);
        @SuppressWarnings("unchecked")
        Map<String, Object> snapshot = (Map<String, Object>) confirmed.metadata().get("keySnapshot");
        assertThat(snapshot).containsEntry("channelId", "channel-alpha").containsEntry("deleted", false);
    }

    @Test
    @DisplayName("A second confirmation of the same code is refused")
    void confirmIsSingleUse() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);
        workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY);

        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY))
                .isInstanceOf(InvalidStateException.class);
        verify(outboxPublisher).publish(any(), any(), any(), anyMap());
    }

    @Test
    @DisplayName("A wrong code reports remaining attempts and leaves the key alone")
    void wrongCode() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);

        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), "not-the-code", RAW_KEY))
                .isInstanceOfSatisfying(InvalidCodeException.class,
                        e -> assertThat(e.getAttemptsRemaining()).isEqualTo(4));
        assertThat(key.isDeleted()).isFalse();
    }

    @Test
    @DisplayName("After five wrong codes the right one is locked out")
    void lockout() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);
        for (int i = 0; i < 4; i++) {
            int attempt = i;
            assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), "wrong-" + attempt, RAW_KEY))
                    .isInstanceOf(InvalidCodeException.class);
        }
        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), "wrong-4", RAW_KEY))
                .isInstanceOf(LockedException.class);

        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY))
                .isInstanceOfSatisfying(LockedException.class,
                        e -> assertThat(e.getRetryAfterSeconds()).isBetween(1L, 3600L));
        assertThat(key.isDeleted()).isFalse();
    }

    @Test
    @DisplayName("An expired confirmation cannot be confirmed, and a new request may replace it")
    void expiredConfirmation() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, 1);
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY))
                .isInstanceOf(ExpiredException.class);

        RevocationTicket replacement = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);
        assertThat(replacement.revocationId()).isNotEqualTo(ticket.revocationId());
    }

    @Test
    @DisplayName("Blank codes are a validation error")
    void blankCode() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);

        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), "   ", RAW_KEY))
                .isInstanceOf(ValidationException.class);
        assertThat(store.get(ticket.revocationId()).getAttemptCount()).isZero();
    }

    @Test
    @DisplayName("Requesting revocation of a revoked key reports the revoking confirmation")
    void alreadyRevoked() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);
        workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY);

        assertThatThrownBy(() -> workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null))
                .isInstanceOfSatisfying(AlreadyRevokedException.class,
                        e -> assertThat(e.getRevocationId()).isEqualTo(ticket.revocationId()));
    }

    @Test
    @DisplayName("Cancel ends the pending confirmation and frees the key for a new request")
    void cancel() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);

        RevocationStatusView view = workflow.cancelRevocation(ticket.revocationId(), RAW_KEY);

        assertThat(view.status()).isEqualTo(RevocationStatus.CANCELLED);
        assertThatThrownBy(() -> workflow.cancelRevocation(ticket.revocationId(), RAW_KEY))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> workflow.confirmRevocation(ticket.revocationId(), ticket.confirmationCode(), RAW_KEY))
                .isInstanceOf(InvalidStateException.class);
        assertThat(workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null).revocationId())
                .isNotEqualTo(ticket.revocationId());
    }

    @Test
    @DisplayName("Status and pending lookups reflect the stored record")
    void statusLookups() {
        RevocationTicket ticket = workflow.requestRevocation(key.getId(), RAW_KEY, REASON, null);

        RevocationStatusView byId = workflow.getStatus(ticket.revocationId(), RAW_KEY);
        RevocationStatusView byKey = workflow.getPendingForKey(key.getId(), RAW_KEY);

        assertThat(byId.status()).isEqualTo(RevocationStatus.PENDING);
        assertThat(byId.channelId()).isEqualTo("channel-alpha");
        assertThat(byKey.revocationId()).isEqualTo(ticket.revocationId());

        clock.advance(Duration.ofHours(25));
        assertThat(workflow.getStatus(ticket.revocationId(), RAW_KEY).status()).isEqualTo(RevocationStatus.EXPIRED);
        assertThatThrownBy(() -> workflow.getPendingForKey(key.getId(), RAW_KEY))
                .isInstanceOf(NotFoundException.class);
    }
}
