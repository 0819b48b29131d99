package com.example.negotiation.service;

import com.example.negotiation.config.NegotiationProperties;
import com.example.negotiation.service.exception.ConversationNotFoundException;
import com.example.negotiation.service.exception.DependencyUnavailableException;
import com.example.negotiation.service.exception.ServiceException;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Bounds every listing registry lookup by {@code negotiation.listing-registry.timeout}, whatever the
 * registry implementation does internally.
 */
@Slf4j
@Component
public class SellerOfRecordResolver {

    private final ListingRegistry listingRegistry;
    private final Duration timeout;
    private final ExecutorService lookupExecutor;

    @Autowired
    public SellerOfRecordResolver(ListingRegistry listingRegistry, NegotiationProperties properties) {
        this(listingRegistry, properties.getListingRegistry().getTimeout());
    }

    SellerOfRecordResolver(ListingRegistry listingRegistry, Duration timeout) {
        this.listingRegistry = listingRegistry;
        this.timeout = timeout;
        AtomicInteger threadCounter = new AtomicInteger();
        this.lookupExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "listing-lookup-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Resolves the seller of record for {@code productId}.
     *
     * @throws ConversationNotFoundException when the registry does not know the product
     * @throws DependencyUnavailableException when the registry fails or does not answer in time
     */
    public String requireSeller(String productId) {
        CompletableFuture<Optional<String>> lookup = CompletableFuture.supplyAsync(
                () -> listingRegistry.resolveProductSeller(productId), lookupExecutor);
        Optional<String> seller;
        try {
            seller = lookup.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            lookup.cancel(true);
            log.warn("Listing registry did not answer for product {} within {}", productId, timeout);
            throw new DependencyUnavailableException(
                    "Listing registry timed out resolving product %s".formatted(productId), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            lookup.cancel(true);
            throw new DependencyUnavailableException(
                    "Interrupted while resolving product %s".formatted(productId), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ServiceException serviceException) {
                throw serviceException;
            }
            log.warn("Listing registry lookup failed for product {}", productId, cause);
            throw new DependencyUnavailableException(
                    "Listing registry failed resolving product %s".formatted(productId), cause);
        }
        return seller.filter(StringUtils::hasText).orElseThrow(() -> ConversationNotFoundException.forProduct(productId));
    }

    @PreDestroy
    void shutdown() {
        lookupExecutor.shutdownNow();
    }
}
