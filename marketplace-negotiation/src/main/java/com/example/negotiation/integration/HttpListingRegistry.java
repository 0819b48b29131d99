package com.example.negotiation.integration;

import com.example.negotiation.config.NegotiationProperties;
import com.example.negotiation.service.ListingRegistry;
import com.example.negotiation.service.exception.DependencyUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Resolves sellers against the catalog service over HTTP. Accepts {@code seller_id}, {@code sellerId} or a
 * nested {@code seller.id} in the product document.
 */
@Slf4j
@Component
public class HttpListingRegistry implements ListingRegistry {

    private final RestTemplate restTemplate;
    private final NegotiationProperties properties;

    public HttpListingRegistry(
            @Qualifier("listingRegistryRestTemplate") RestTemplate restTemplate, NegotiationProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public Optional<String> resolveProductSeller(String productId) {
        JsonNode product;
        try {
            product = restTemplate.getForObject(
                    properties.getListingRegistry().getProductPath(), JsonNode.class, productId);
        } catch (HttpClientErrorException.NotFound ex) {
            log.debug("Listing registry has no product {}", productId);
            return Optional.empty();
        } catch (RestClientException ex) {
            throw new DependencyUnavailableException(
                    "Listing registry request failed for product %s".formatted(productId), ex);
        }
        return Optional.ofNullable(product).flatMap(HttpListingRegistry::sellerOf);
    }

    static Optional<String> sellerOf(JsonNode product) {
        JsonNode seller = product.path("seller_id");
        if (seller.isMissingNode() || seller.isNull()) {
            seller = product.path("sellerId");
        }
        if (seller.isMissingNode() || seller.isNull()) {
            seller = product.path("seller").path("id");
        }
        if (seller.isMissingNode() || seller.isNull() || seller.isContainerNode()) {
            return Optional.empty();
        }
        String sellerId = seller.asText();
        return sellerId.isBlank() ? Optional.empty() : Optional.of(sellerId);
    }
}
