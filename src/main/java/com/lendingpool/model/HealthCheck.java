package com.lendingpool.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Health of one loan at current prices. {@code healthFactor} below 1 means liquidatable.
 */
public record HealthCheck(
    Long loanId,
    BigDecimal collateralValueUsd,
    BigDecimal debtValueUsd,
    BigDecimal healthFactor,
    boolean liquidatable,
    Instant asOf
) {
}
