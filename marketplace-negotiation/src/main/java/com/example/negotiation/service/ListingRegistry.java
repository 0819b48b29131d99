package com.example.negotiation.service;

import java.util.Optional;

/**
 * Catalog collaborator answering "who sells this product". Implementations report an unknown product as an
 * empty result and collaborator outages as
 * {@link com.example.negotiation.service.exception.DependencyUnavailableException}.
 */
public interface ListingRegistry {

    Optional<String> resolveProductSeller(String productId);
}
