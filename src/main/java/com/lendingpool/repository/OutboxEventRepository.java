package com.lendingpool.repository;

import com.lendingpool.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for outbox events.
 *
 * Key queries:
 * - Unpublished events in creation order (publisher batch)
 * - Old unpublished events (stuck-event alerting)
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Oldest unpublished events first, at most {@code limit} of them.
     */
    @Query(value = "SELECT * FROM outbox_events WHERE published = false ORDER BY created_at ASC LIMIT ?1",
           nativeQuery = true)
    List<OutboxEvent> findUnpublishedEventsWithLimit(int limit);

    List<OutboxEvent> findByPublishedFalseAndCreatedAtBefore(Instant before);

    long countByPublishedFalse();
}
