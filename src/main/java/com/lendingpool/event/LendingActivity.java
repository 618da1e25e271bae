package com.lendingpool.event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event recorded after a committed pool or loan mutation.
 *
 * Consumed outside the engine (rewards distribution, analytics). Nothing inside the
 * accounting path depends on its delivery.
 */
public record LendingActivity(
    String eventId,
    ActivityType type,
    String account,        // depositor, borrower or reserve recipient
    String asset,
    BigDecimal amount,
    Long loanId,           // null for pool-only activity
    Instant timestamp
) {
    public LendingActivity {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Activity type cannot be null");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
