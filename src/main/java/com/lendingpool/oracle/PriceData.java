package com.lendingpool.oracle;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One price observation: USD per whole unit of the asset, when it was observed,
 * and the feed's confidence in basis points (10000 = fully confident).
 */
public record PriceData(
    BigDecimal price,
    Instant timestamp,
    int confidenceBps
) {
}
