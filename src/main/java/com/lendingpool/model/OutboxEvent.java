package com.lendingpool.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TRANSACTIONAL OUTBOX
 * ====================
 *
 * Activity events (deposit, borrow, repay, liquidation, ...) are written to this table
 * in the SAME transaction as the accounting change that produced them.
 *
 * - Accounting commits  -> the event row commits with it
 * - Accounting rolls back -> the event row disappears with it
 *
 * OutboxEventPublisher relays committed rows to Kafka and marks them published.
 * Downstream consumers (rewards distributor, analytics) therefore never see an
 * event for an operation that was rolled back.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_published", columnList = "published"),
           @Index(name = "idx_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Business identifier of the event.
     */
    @Column(nullable = false)
    private String eventId;

    /**
     * Activity type, e.g. "DEPOSIT" or "LIQUIDATION".
     */
    @Column(nullable = false)
    private String eventType;

    /**
     * Event payload serialized as JSON.
     */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    /**
     * Number of failed publish attempts, for alerting on stuck events.
     */
    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
