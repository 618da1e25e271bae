package com.lendingpool.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lendingpool.config.KafkaTopics;
import com.lendingpool.event.ActivityType;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.LiquidationExecuted;
import com.lendingpool.event.OutboxActivityNotifier;
import com.lendingpool.model.OutboxEvent;
import com.lendingpool.producer.EventProducer;
import com.lendingpool.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxEventPublisherTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private EventProducer eventProducer;

    private ObjectMapper objectMapper;
    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        publisher = new OutboxEventPublisher(outboxEventRepository, eventProducer, objectMapper);
    }

    @Test
    @DisplayName("Pool activity is published keyed by asset and flagged as published")
    void publishesPoolActivity() throws Exception {
        OutboxEvent row = row("DEPOSIT", KafkaTopics.LENDING_ACTIVITY, new LendingActivity("evt-1", ActivityType.DEPOSIT,
                "alice", "USDC", new BigDecimal("100"), null, Instant.parse("2024-01-01T00:00:00Z")));
        when(outboxEventRepository.findUnpublishedEventsWithLimit(anyInt())).thenReturn(List.of(row));
        when(eventProducer.publish(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        publisher.publishEvents();

        verify(eventProducer).publish(eq(KafkaTopics.LENDING_ACTIVITY), eq("pool-USDC"), any(LendingActivity.class));
        assertThat(row.getPublished()).isTrue();
        assertThat(row.getPublishedAt()).isNotNull();
    }

    @Test
    @DisplayName("Liquidations are published keyed by loan")
    void publishesLiquidation() throws Exception {
        OutboxEvent row = row(OutboxActivityNotifier.LIQUIDATION_EVENT_TYPE, KafkaTopics.LENDING_LIQUIDATIONS,
                new LiquidationExecuted("evt-2", 7L, "liq", "bob", "USDC", new BigDecimal("800"),
                        "WETH", new BigDecimal("1000"), new BigDecimal("47.6"), true, Instant.parse("2024-01-01T00:00:00Z")));
        when(outboxEventRepository.findUnpublishedEventsWithLimit(anyInt())).thenReturn(List.of(row));
        when(eventProducer.publish(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        publisher.publishEvents();

        verify(eventProducer).publish(eq(KafkaTopics.LENDING_LIQUIDATIONS), eq("loan-7"), any(LiquidationExecuted.class));
        assertThat(row.getPublished()).isTrue();
    }

    @Test
    @DisplayName("A failed send keeps the row unpublished and counts the attempt")
    void failedSendIsRetried() throws Exception {
        OutboxEvent row = row("BORROW", KafkaTopics.LENDING_ACTIVITY, new LendingActivity("evt-3", ActivityType.BORROW,
                "bob", "USDC", new BigDecimal("800"), 1L, Instant.parse("2024-01-01T00:00:00Z")));
        when(outboxEventRepository.findUnpublishedEventsWithLimit(anyInt())).thenReturn(List.of(row));
        when(eventProducer.publish(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvents();

        assertThat(row.getPublished()).isFalse();
        assertThat(row.getRetryCount()).isEqualTo(1);
        assertThat(row.getLastError()).contains("broker down");
        verify(outboxEventRepository).save(row);
    }

    private OutboxEvent row(String type, String topic, Object event) throws Exception {
        OutboxEvent row = new OutboxEvent();
        row.setEventId("row-" + type);
        row.setEventType(type);
        row.setTopic(topic);
        row.setPayload(objectMapper.writeValueAsString(event));
        return row;
    }
}
