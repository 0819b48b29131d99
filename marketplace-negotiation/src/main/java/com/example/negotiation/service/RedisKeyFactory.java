package com.example.negotiation.service;

import com.example.negotiation.config.NegotiationProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final NegotiationProperties properties;

    public RedisKeyFactory(NegotiationProperties properties) {
        this.properties = properties;
    }

    private String prefix() {
        return properties.getRedis().getKeyPrefix();
    }

    public String conversationAppendLockKey(String conversationId) {
        return "%s:conversation:%s:append-lock".formatted(prefix(), conversationId);
    }

    public String conversationCreationLockKey(String productId, String buyerId) {
        return "%s:product:%s:buyer:%s:create-lock".formatted(prefix(), productId, buyerId);
    }

    public String readMarkerLockKey(String conversationId, String userId) {
        return "%s:conversation:%s:reader:%s:lock".formatted(prefix(), conversationId, userId);
    }
}
