package com.lendingpool.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable copy of a {@link Pool}, safe to hand to other components and to the API.
 */
public record PoolView(
    String asset,
    BigDecimal totalDeposits,
    BigDecimal totalBorrows,
    BigDecimal totalReserves,
    Instant lastUpdateTime,
    boolean active,
    boolean borrowingEnabled,
    boolean depositsEnabled,
    int collateralFactorBps,
    int liquidationBonusBps
) {
}
