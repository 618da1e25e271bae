package com.lendingpool.oracle;

import com.lendingpool.config.LendingProperties;
import com.lendingpool.util.AssetIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;

/**
 * Blocking client for an HTTP price service.
 *
 * GET {baseUrl}/prices/{asset} -> {"price": "1.0001", "timestamp": "2024-05-01T10:00:00Z", "confidenceBps": 9900}
 *
 * Connect and read timeouts come from the RestTemplate (see PriceFeedConfig), so a
 * hanging price service surfaces as a PriceFeedException instead of a stuck operation.
 */
@Component
@ConditionalOnProperty(prefix = "lending.price-feed", name = "type", havingValue = "http")
@Slf4j
public class HttpPriceFeed implements PriceFeed {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpPriceFeed(@Qualifier("priceFeedRestTemplate") RestTemplate restTemplate, LendingProperties props) {
        this.restTemplate = restTemplate;
        this.baseUrl = props.getPriceFeed().getBaseUrl();
        Assert.hasText(baseUrl, "lending.price-feed.base-url is required for the http price feed");
    }

    @Override
    public PriceData getPrice(String asset) {
        String key = AssetIds.normalize(asset);
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("prices", key)
                .build()
                .toUri();
        try {
            ResponseEntity<PriceResponse> resp = restTemplate.getForEntity(uri, PriceResponse.class);
            PriceResponse body = resp.getBody();
            HttpStatusCode status = resp.getStatusCode();
            if (!status.is2xxSuccessful() || body == null) {
                throw new PriceFeedException("Price service HTTP " + status + " for " + key);
            }
            if (body.price() == null || body.timestamp() == null || body.confidenceBps() == null) {
                throw new PriceFeedException("Incomplete price payload for " + key);
            }
            log.debug("Fetched price for {}: {} at {}", key, body.price(), body.timestamp());
            return new PriceData(body.price(), body.timestamp(), body.confidenceBps());
        } catch (RestClientException e) {
            throw new PriceFeedException("Price service call failed for " + key + ": " + e.getMessage(), e);
        }
    }

    record PriceResponse(BigDecimal price, Instant timestamp, Integer confidenceBps) {
    }
}
