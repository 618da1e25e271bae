package com.lendingpool.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Time source and outbound HTTP wiring for the price feed.
 */
@Configuration
public class PriceFeedConfig {

    /**
     * Every accrual and staleness check reads time from here.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("priceFeedRestTemplate")
    @ConditionalOnProperty(prefix = "lending.price-feed", name = "type", havingValue = "http")
    public RestTemplate priceFeedRestTemplate(LendingProperties props) {
        LendingProperties.PriceFeed cfg = props.getPriceFeed();
        return buildRestTemplate(cfg.getConnectTimeoutSec(), cfg.getReadTimeoutSec());
    }

    private RestTemplate buildRestTemplate(int connectTimeoutSec, int readTimeoutSec) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setResponseTimeout(Timeout.ofSeconds(readTimeoutSec))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);
        f.setConnectTimeout(connectTimeoutSec * 1000);
        return new RestTemplate(f);
    }
}
