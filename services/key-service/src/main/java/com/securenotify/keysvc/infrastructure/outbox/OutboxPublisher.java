package com.securenotify.keysvc.infrastructure.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securenotify.keysvc.domain.model.OutboxEvent;
import com.securenotify.keysvc.infrastructure.persistence.OutboxEventRepository;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Records key lifecycle events (for example {@code PublicKeyRevoked}) in the outbox table as part of the
 * revocation transaction. {@link OutboxDispatcher} forwards them to Kafka after commit.
 *
 * <p>The stored JSON wraps the event data in an envelope:
 * {@code {"eventType", "aggregateId", "occurredAt", "correlationId", "data"}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(String aggregateType, UUID aggregateId, String eventType, Map<String, Object> data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("eventType", eventType);
        envelope.put("aggregateId", aggregateId.toString());
        envelope.put("occurredAt", clock.instant().toString());
        envelope.put("correlationId", securityUtils.getCurrentCorrelationId());
        envelope.put("data", data);

        OutboxEvent event = OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payloadJson(toJson(eventType, envelope))
                .build();
        outboxRepository.save(event);
        log.debug("Outbox event recorded: type={}, aggregateId={}", eventType, aggregateId);
    }

    private String toJson(String eventType, Map<String, Object> envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            // fails the enclosing revocation transaction
            throw new IllegalStateException("Cannot serialize outbox event " + eventType, e);
        }
    }
}
