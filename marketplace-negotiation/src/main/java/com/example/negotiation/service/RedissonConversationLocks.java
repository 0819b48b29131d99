package com.example.negotiation.service;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class RedissonConversationLocks implements ConversationLocks {

    private final RedissonClient redissonClient;

    @Override
    public <T> T withLock(String lockKey, Supplier<T> action) {
        if (!StringUtils.hasText(lockKey)) {
            throw new IllegalArgumentException("Lock key is required");
        }
        RLock lock = redissonClient.getLock(lockKey);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
