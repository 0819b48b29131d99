package com.example.negotiation.service;

import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by an opaque string, held for the duration of {@code action}.
 */
public interface ConversationLocks {

    <T> T withLock(String lockKey, Supplier<T> action);
}
