package com.securenotify.keysvc.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * A key lifecycle event waiting to be relayed to Kafka. Rows are written in the same transaction
 * as the change they describe and are keyed by aggregate id, so events for one key stay ordered
 * within a partition.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class OutboxEvent {

    static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload_json", nullable = false, columnDefinition = "jsonb")
    private String payloadJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public String partitionKey() {
        return aggregateId.toString();
    }

    public boolean isProcessed() {
        return processedAt != null;
    }

    public void markAsProcessed() {
        Instant now = Instant.now();
        this.lastAttemptAt = now;
        this.processedAt = now;
        this.lastError = null;
    }

    public void recordFailure(String error) {
        this.lastAttemptAt = Instant.now();
        this.retryCount++;
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
    }

    /**
     * True once the relay has given up on this event.
     */
    public boolean isExhausted(int maxRetries) {
        return !isProcessed() && retryCount >= maxRetries;
    }
}
