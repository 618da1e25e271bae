package com.lendingpool.service;

import com.lendingpool.config.LendingProperties;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.oracle.PriceData;
import com.lendingpool.oracle.PriceFeed;
import com.lendingpool.oracle.PriceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single entry point to the price feed.
 *
 * Every valuation goes through {@link #validatedPrice(String)}: a price older than
 * {@code lending.oracle.max-price-age}, below {@code lending.oracle.min-confidence-bps}
 * or not positive is rejected with a LendingException and never used.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValuationService {

    private final PriceFeed priceFeed;
    private final LendingProperties props;
    private final Clock clock;

    public PriceData validatedPrice(String asset) {
        PriceData data;
        try {
            data = priceFeed.getPrice(asset);
        } catch (RuntimeException e) {
            log.warn("Price feed failed for {}: {}", asset, e.getMessage());
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "No price available for " + asset, e);
        }

        if (data == null || data.price() == null || data.price().signum() <= 0 || data.timestamp() == null) {
            throw LendingException.of(LendingError.PRICE_UNAVAILABLE, "Invalid price for %s", asset);
        }

        Duration age = Duration.between(data.timestamp(), Instant.now(clock));
        if (age.compareTo(props.getOracle().getMaxPriceAge()) > 0) {
            log.warn("Rejected stale price for {}: {}s old", asset, age.getSeconds());
            throw LendingException.of(LendingError.STALE_PRICE_DATA,
                    "Price for %s is %ds old", asset, age.getSeconds());
        }

        int minConfidence = props.getOracle().getMinConfidenceBps();
        if (data.confidenceBps() < minConfidence) {
            log.warn("Rejected low-confidence price for {}: {} bps", asset, data.confidenceBps());
            throw LendingException.of(LendingError.LOW_CONFIDENCE_PRICE,
                    "Price confidence for %s is %d bps, minimum is %d", asset, data.confidenceBps(), minConfidence);
        }
        return data;
    }

    /**
     * Validates prices for all given assets. Either every price passes or the call throws.
     */
    public PriceSnapshot snapshot(String... assets) {
        Map<String, PriceData> prices = new LinkedHashMap<>();
        for (String asset : assets) {
            prices.computeIfAbsent(asset, this::validatedPrice);
        }
        return new PriceSnapshot(prices);
    }
}
