package com.example.negotiation.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "negotiation.security")
public class NegotiationSecurityProperties {

    /**
     * Refuse conversation creation and message posting to principals the identity gate has not verified.
     */
    private boolean requireVerifiedForWrites = false;

    private boolean rateLimitingEnabled = true;

    /**
     * Browser origins allowed to call the API directly; calls through the gateway need no entry here.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost:5173"));

    private final RateLimit rateLimit = new RateLimit();

    /**
     * One bucket per caller and route. Polling clients share the bucket of the route they poll.
     */
    @Getter
    @Setter
    public static class RateLimit {

        /**
         * Requests below this path are limited; everything else (docs, actuator) passes through.
         */
        private String pathPrefix = "/api/";

        private long capacity = 120;

        private long refillTokens = 120;

        private Duration refillPeriod = Duration.ofSeconds(60);

        Duration effectiveRefillPeriod() {
            if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
                return Duration.ofSeconds(60);
            }
            return refillPeriod;
        }
    }
}
