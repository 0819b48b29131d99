package com.example.negotiation.config;

import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ListingRegistryConfig {

    /**
     * Client used for seller-of-record lookups; connect and read are both bounded by the registry timeout.
     */
    @Bean
    public RestTemplate listingRegistryRestTemplate(RestTemplateBuilder builder, NegotiationProperties properties) {
        NegotiationProperties.ListingRegistry registry = properties.getListingRegistry();
        Duration timeout = registry.getTimeout() != null && !registry.getTimeout().isNegative()
                && !registry.getTimeout().isZero()
                ? registry.getTimeout()
                : Duration.ofSeconds(3);
        return builder
                .rootUri(registry.getBaseUrl())
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
