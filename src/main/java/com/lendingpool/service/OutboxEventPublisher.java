package com.lendingpool.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.LiquidationExecuted;
import com.lendingpool.event.OutboxActivityNotifier;
import com.lendingpool.model.OutboxEvent;
import com.lendingpool.producer.EventProducer;
import com.lendingpool.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Relays committed activity events from the outbox table to Kafka.
 *
 * HOW IT WORKS:
 * -------------
 * 1. Runs every 500ms
 * 2. Loads the oldest unpublished events (bounded batch)
 * 3. For each event: deserialize, send, wait for the broker ack, mark published
 * 4. On failure: increment retry count, keep the row, try again next poll
 *
 * This task only reads and flags outbox rows. It never touches pool or loan state,
 * so a Kafka outage cannot block or roll back lending operations.
 *
 * PRODUCTION CONSIDERATIONS:
 * --------------------------
 * With more than one instance running, add a distributed lock (ShedLock or a Redis lock)
 * around publishEvents() or events are published twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;

    private static final int BATCH_SIZE = 100;
    private static final int MAX_RETRY_COUNT = 10; // escalate to error logging after this many attempts
    private static final long SEND_TIMEOUT_SECONDS = 10;

    @Scheduled(fixedDelay = 500)
    @Transactional
    public void publishEvents() {
        try {
            List<OutboxEvent> events = outboxEventRepository.findUnpublishedEventsWithLimit(BATCH_SIZE);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());

            for (OutboxEvent event : events) {
                try {
                    publishEvent(event);
                } catch (Exception e) {
                    handlePublishError(event, e);
                }
            }

        } catch (Exception e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    private void publishEvent(OutboxEvent outboxEvent) throws Exception {
        Object event = deserializeEvent(outboxEvent);

        eventProducer.publish(outboxEvent.getTopic(), recordKey(event), event)
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now());
        outboxEventRepository.save(outboxEvent);

        log.debug("Marked outbox event {} (type: {}) as published",
                 outboxEvent.getEventId(), outboxEvent.getEventType());
    }

    Object deserializeEvent(OutboxEvent outboxEvent) throws Exception {
        if (OutboxActivityNotifier.LIQUIDATION_EVENT_TYPE.equals(outboxEvent.getEventType())) {
            return objectMapper.readValue(outboxEvent.getPayload(), LiquidationExecuted.class);
        }
        return objectMapper.readValue(outboxEvent.getPayload(), LendingActivity.class);
    }

    /**
     * Loan id when there is one, otherwise the asset: keeps per-loan and per-pool ordering.
     */
    private String recordKey(Object event) {
        if (event instanceof LiquidationExecuted l) {
            return "loan-" + l.loanId();
        }
        LendingActivity a = (LendingActivity) event;
        return a.loanId() != null ? "loan-" + a.loanId() : "pool-" + a.asset();
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(e.getMessage());
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), e.getMessage());
        }
    }

    /**
     * Reports events that stayed unpublished for more than five minutes.
     */
    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            Instant threshold = Instant.now().minusSeconds(300);
            List<OutboxEvent> stuckEvents = outboxEventRepository
                    .findByPublishedFalseAndCreatedAtBefore(threshold);

            if (!stuckEvents.isEmpty()) {
                log.error("Found {} stuck events older than 5 minutes.", stuckEvents.size());
                stuckEvents.forEach(event ->
                    log.error("Stuck event: id={}, eventId={}, eventType={}, createdAt={}, retryCount={}, lastError={}",
                              event.getId(), event.getEventId(), event.getEventType(),
                              event.getCreatedAt(), event.getRetryCount(), event.getLastError())
                );
            }

            long queueSize = outboxEventRepository.countByPublishedFalse();
            if (queueSize > 1000) {
                log.warn("Outbox queue size is {}, which is high.", queueSize);
            } else {
                log.debug("Outbox queue size: {}", queueSize);
            }

        } catch (Exception e) {
            log.error("Error monitoring stuck events", e);
        }
    }
}
