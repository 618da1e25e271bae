package com.lendingpool.oracle;

import com.lendingpool.util.FixedPoint;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Validated prices for the assets one operation touches, all read before any state changes.
 */
public record PriceSnapshot(Map<String, PriceData> prices) {

    public PriceSnapshot {
        prices = Map.copyOf(prices);
    }

    public BigDecimal priceOf(String asset) {
        PriceData data = prices.get(asset);
        if (data == null) {
            throw new IllegalStateException("No validated price for " + asset + " in this snapshot");
        }
        return data.price();
    }

    /** USD value of {@code amount} units of {@code asset}, truncated. */
    public BigDecimal valueOf(String asset, BigDecimal amount) {
        return FixedPoint.of(amount.multiply(priceOf(asset)));
    }

    /** How many units of {@code to} are worth {@code amount} units of {@code from}, truncated. */
    public BigDecimal convert(String from, BigDecimal amount, String to) {
        return FixedPoint.mulDiv(amount, priceOf(from), priceOf(to));
    }
}
