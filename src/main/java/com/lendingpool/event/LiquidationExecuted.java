package com.lendingpool.event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event recorded after a (partial or full) liquidation.
 */
public record LiquidationExecuted(
    String eventId,
    Long loanId,
    String liquidator,
    String borrower,
    String borrowAsset,
    BigDecimal repaidAmount,
    String collateralAsset,
    BigDecimal collateralSeized,   // includes the bonus
    BigDecimal bonus,
    boolean loanClosed,
    Instant timestamp
) {
    public LiquidationExecuted {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (loanId == null) {
            throw new IllegalArgumentException("Loan ID cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
