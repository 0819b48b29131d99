package com.example.negotiation.event;

import com.example.negotiation.domain.MessageType;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signal that a message is waiting for its recipient. Carries references only; the recipient fetches
 * the content through the message listing. {@code eventId} is stable per stored message so consumers
 * can deduplicate redeliveries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDeliveryEvent implements Serializable {

    private String eventId;
    private String conversationId;
    private String productId;
    private String recipientId;
    private String senderId;
    private long sequence;
    private MessageType messageType;
    private long recipientUnreadCount;
    private Instant occurredAt;
}
