package com.lendingpool.producer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Sends outbox payloads to Kafka.
 *
 * ASYNC:
 * ======
 * send() returns immediately; the broker acknowledgement arrives on the returned future.
 * The outbox publisher waits on it before marking a row published, so an unacknowledged
 * event is retried on the next poll.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * @param topic target topic
     * @param key   record key; activity for one asset or loan lands on one partition
     * @param event the event record
     */
    public CompletableFuture<SendResult<String, Object>> publish(String topic, String key, Object event) {

        log.debug("Publishing {} to {} with key {}", event.getClass().getSimpleName(), topic, key);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} with key {}", event.getClass().getSimpleName(), key, ex);
            } else {
                log.info("Published {} with key {} to {}-{}",
                        event.getClass().getSimpleName(), key, topic, result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}
