package com.example.negotiation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "negotiation")
public class NegotiationProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Messages messages = new Messages();

    @NestedConfigurationProperty
    private final Conversations conversations = new Conversations();

    @NestedConfigurationProperty
    private final ListingRegistry listingRegistry = new ListingRegistry();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Messages getMessages() {
        return messages;
    }

    public Conversations getConversations() {
        return conversations;
    }

    public ListingRegistry getListingRegistry() {
        return listingRegistry;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the negotiation module.
         */
        private String keyPrefix = "negotiation";

        /**
         * Lease renewal interval for conversation locks held by a live instance; a crashed holder releases
         * its locks once this elapses.
         */
        private Duration lockWatchdogTimeout = Duration.ofSeconds(30);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getLockWatchdogTimeout() {
            return lockWatchdogTimeout;
        }

        public void setLockWatchdogTimeout(Duration lockWatchdogTimeout) {
            this.lockWatchdogTimeout = lockWatchdogTimeout;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving one delivery event per stored message, keyed by recipient.
         */
        private String deliveryTopic = "negotiation.deliveries";

        /**
         * Kafka topic receiving conversation lifecycle events.
         */
        private String lifecycleTopic = "negotiation.lifecycle";

        public String getDeliveryTopic() {
            return deliveryTopic;
        }

        public void setDeliveryTopic(String deliveryTopic) {
            this.deliveryTopic = deliveryTopic;
        }

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }
    }

    @Validated
    public static class Messages {

        /**
         * Page size used when a message listing does not specify a limit.
         */
        private int defaultPageSize = 50;

        /**
         * Upper bound applied to any requested message page size.
         */
        private int maxPageSize = 200;

        /**
         * Maximum number of characters accepted in a message body.
         */
        private int maxBodyLength = 5000;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getMaxBodyLength() {
            return maxBodyLength;
        }

        public void setMaxBodyLength(int maxBodyLength) {
            this.maxBodyLength = maxBodyLength;
        }
    }

    @Validated
    public static class Conversations {

        /**
         * Upper bound applied to a conversation listing page.
         */
        private int maxPageSize = 100;

        /**
         * Number of most recent messages embedded in a conversation detail view.
         */
        private int detailMessageLimit = 50;

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getDetailMessageLimit() {
            return detailMessageLimit;
        }

        public void setDetailMessageLimit(int detailMessageLimit) {
            this.detailMessageLimit = detailMessageLimit;
        }
    }

    @Validated
    public static class ListingRegistry {

        /**
         * Base URL of the catalog service that owns product listings.
         */
        private String baseUrl = "http://localhost:8000";

        /**
         * Path template resolving a single product; {@code {productId}} is expanded.
         */
        private String productPath = "/api/v1/products/{productId}";

        /**
         * Upper bound on a single seller lookup, connect and read included.
         */
        private Duration timeout = Duration.ofSeconds(3);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getProductPath() {
            return productPath;
        }

        public void setProductPath(String productPath) {
            this.productPath = productPath;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
