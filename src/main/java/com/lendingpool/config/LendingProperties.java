package com.lendingpool.config;

import com.lendingpool.access.AdminAction;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Protocol-wide risk, oracle and interest settings, bound from the {@code lending.*} keys.
 */
@Configuration
@ConfigurationProperties(prefix = "lending")
@Data
public class LendingProperties {
    private Risk risk = new Risk();
    private Oracle oracle = new Oracle();
    private Interest interest = new Interest();
    private Access access = new Access();
    private PriceFeed priceFeed = new PriceFeed();

    // initial reserve recipient, changeable by operators afterwards
    private String feeRecipient = "treasury";

    @Data
    public static class Risk {
        private BigDecimal minLoanAmount = BigDecimal.ONE;
        private int maxUtilizationBps = 9000;
        private int liquidationThresholdBps = 8500;
        private int maxCollateralFactorBps = 9000;
        private int maxLiquidationBonusBps = 2000;
    }

    @Data
    public static class Oracle {
        private Duration maxPriceAge = Duration.ofHours(1);
        private int minConfidenceBps = 9500;
    }

    /** Default curve, seeded into the store on first start. */
    @Data
    public static class Interest {
        private int baseRateBps = 200;
        private int slope1Bps = 400;
        private int slope2Bps = 7500;
        private int optimalUtilizationBps = 8000;
        private int reserveFactorBps = 1000;
    }

    @Data
    public static class Access {
        // caller id -> granted actions
        private Map<String, Set<AdminAction>> grants = new HashMap<>();
    }

    @Data
    public static class PriceFeed {
        private String type = "static";
        private String baseUrl;
        private int connectTimeoutSec = 2;
        private int readTimeoutSec = 3;
    }
}
