package com.example.negotiation.event;

/**
 * In-process hook for notification side effects (push, e-mail, badges). Implementations must be idempotent
 * on {@code eventId}.
 */
public interface ChatEventListener {

    default void onLifecycleEvent(ConversationLifecycleEvent event) {
    }

    default void onDeliveryEvent(MessageDeliveryEvent event) {
    }
}
