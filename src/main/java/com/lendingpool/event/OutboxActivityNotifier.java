package com.lendingpool.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingpool.config.KafkaTopics;
import com.lendingpool.model.OutboxEvent;
import com.lendingpool.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes activity events to the outbox table inside the caller's transaction.
 *
 * A payload that cannot be serialized is reported as a failed result and logged;
 * the accounting change that triggered it still commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxActivityNotifier implements ActivityNotifier {

    public static final String LIQUIDATION_EVENT_TYPE = "LIQUIDATION";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Override
    public NotificationResult notify(LendingActivity activity) {
        return saveToOutbox(activity, activity.eventId(), activity.type().name(), KafkaTopics.LENDING_ACTIVITY);
    }

    @Override
    public NotificationResult notify(LiquidationExecuted liquidation) {
        return saveToOutbox(liquidation, liquidation.eventId(), LIQUIDATION_EVENT_TYPE, KafkaTopics.LENDING_LIQUIDATIONS);
    }

    private NotificationResult saveToOutbox(Object event, String eventId, String eventType, String topic) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event for outbox: {}", eventType, eventId, e);
            return NotificationResult.failed(e.getOriginalMessage());
        }

        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(eventId);
        outboxEvent.setEventType(eventType);
        outboxEvent.setPayload(payload);
        outboxEvent.setTopic(topic);
        outboxEventRepository.save(outboxEvent);

        log.debug("Saved {} event to outbox: {}", eventType, eventId);
        return NotificationResult.ok();
    }
}
