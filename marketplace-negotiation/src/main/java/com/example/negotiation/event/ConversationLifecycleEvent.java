package com.example.negotiation.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Something happened to a conversation as a whole rather than to one message. Keyed by conversation on the
 * lifecycle topic so consumers see a thread's events in order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationLifecycleEvent implements Serializable {

    private String eventId;
    private LifecycleEventType type;
    private String conversationId;
    private String actorId;
    private Instant occurredAt;
    private Map<String, Object> attributes;

    public static ConversationLifecycleEvent of(
            LifecycleEventType type, String conversationId, String actorId, Instant occurredAt,
            Map<String, Object> attributes) {
        return new ConversationLifecycleEvent(
                UUID.randomUUID().toString(), type, conversationId, actorId, occurredAt, Map.copyOf(attributes));
    }
}
