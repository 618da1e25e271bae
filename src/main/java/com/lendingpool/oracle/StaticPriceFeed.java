package com.lendingpool.oracle;

import com.lendingpool.util.AssetIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price feed fed by operators through the admin API.
 *
 * Each posted price is stamped with the time it was posted, so a price nobody
 * refreshes goes stale like any other feed's would.
 */
@Component
@ConditionalOnProperty(prefix = "lending.price-feed", name = "type", havingValue = "static", matchIfMissing = true)
@Slf4j
public class StaticPriceFeed implements PriceFeed {

    private final Map<String, PriceData> prices = new ConcurrentHashMap<>();
    private final Clock clock;

    public StaticPriceFeed(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public PriceData getPrice(String asset) {
        PriceData data = prices.get(AssetIds.normalize(asset));
        if (data == null) {
            throw new PriceFeedException("No price posted for " + asset);
        }
        return data;
    }

    public PriceData post(String asset, BigDecimal price, int confidenceBps) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive");
        }
        if (confidenceBps < 0 || confidenceBps > 10_000) {
            throw new IllegalArgumentException("confidenceBps must be within 0..10000");
        }
        String key = AssetIds.normalize(asset);
        PriceData data = new PriceData(price, clock.instant(), confidenceBps);
        prices.put(key, data);
        log.info("Posted price for {}: {} USD (confidence {} bps)", key, price, confidenceBps);
        return data;
    }
}
