package com.securenotify.keysvc.infrastructure.outbox;

import com.securenotify.keysvc.domain.model.OutboxEvent;
import com.securenotify.keysvc.infrastructure.persistence.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays committed outbox events to Kafka. Each event is acknowledged before it is marked
 * processed; failures bump the retry count and the event is picked up again on the next poll.
 */
@Component
@ConditionalOnProperty(name = "app.outbox.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxDispatcher {

    private static final int BATCH_SIZE = 100;
    private static final int MAX_RETRIES = 10;
    private static final String TOPIC_PREFIX = "key-service.";

    private final OutboxEventRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final long sendTimeoutMs;

    public OutboxDispatcher(OutboxEventRepository outboxRepository,
                            KafkaTemplate<String, String> kafkaTemplate,
                            @Value("${app.outbox.send-timeout-ms:5000}") long sendTimeoutMs) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}")
    @Transactional
    public void dispatchEvents() {
        List<OutboxEvent> events = outboxRepository.findUnprocessedEvents(MAX_RETRIES, PageRequest.of(0, BATCH_SIZE));
        if (events.isEmpty()) {
            return;
        }

        log.debug("Dispatching {} outbox events", events.size());
        for (OutboxEvent event : events) {
            processEvent(event);
        }
    }

    void processEvent(OutboxEvent event) {
        String topic = topicFor(event.getEventType());
        try {
            kafkaTemplate.send(topic, event.partitionKey(), event.getPayloadJson())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            event.markAsProcessed();
            log.debug("Event sent to Kafka: eventId={}, topic={}", event.getId(), topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            event.recordFailure("interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to send event to Kafka: eventId={}, error={}", event.getId(), e.getMessage());
            event.recordFailure(e.getMessage());
        }
        if (event.isExhausted(MAX_RETRIES)) {
            log.error("Outbox event abandoned after {} attempts: eventId={}, type={}, aggregateId={}",
                    MAX_RETRIES, event.getId(), event.getEventType(), event.getAggregateId());
        }
        outboxRepository.save(event);
    }

    /**
     * PublicKeyRevoked becomes key-service.public-key-revoked.
     */
    static String topicFor(String eventType) {
        String kebab = eventType.replaceAll("([a-z0-9])([A-Z])", "$1-$2").replace('_', '-');
        return TOPIC_PREFIX + kebab.toLowerCase(Locale.ROOT);
    }
}
