package com.lendingpool.model;

/**
 * A pool together with its current rates, as reported to API callers.
 */
public record PoolMarket(
    PoolView pool,
    int utilizationBps,
    int borrowRateBps,
    int supplyRateBps
) {
}
