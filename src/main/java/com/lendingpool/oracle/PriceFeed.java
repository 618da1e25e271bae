package com.lendingpool.oracle;

/**
 * External price source. Implementations may block on I/O and may fail; they must be
 * time-bounded. Freshness and confidence are judged by the caller, not by the feed.
 */
public interface PriceFeed {

    /**
     * @throws PriceFeedException when no price can be obtained (unknown asset, timeout, transport error)
     */
    PriceData getPrice(String asset);
}
