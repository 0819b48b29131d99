package com.example.negotiation.dto;

import com.example.negotiation.domain.NegotiationState;
import com.example.negotiation.domain.ParticipantRole;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A conversation as seen by one of its participants.
 */
@Value
@Builder(toBuilder = true)
public class ConversationSummary {

    String id;
    String productId;
    String buyerId;
    String sellerId;
    ParticipantRole role;
    String counterpartId;
    Instant createdAt;
    Instant lastActivityAt;
    long lastSequence;
    boolean archived;
    long unreadCount;
    NegotiationState negotiation;
}
