package com.example.negotiation.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMetadata implements Serializable {

    private String id;
    private String productId;
    private String buyerId;
    private String sellerId;
    private Instant createdAt;
    private Instant lastActivityAt;
    private long lastSequence;
    private Instant buyerArchivedAt;
    private Instant sellerArchivedAt;
    private Long version;

    public Optional<ParticipantRole> roleOf(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        if (userId.equals(buyerId)) {
            return Optional.of(ParticipantRole.BUYER);
        }
        if (userId.equals(sellerId)) {
            return Optional.of(ParticipantRole.SELLER);
        }
        return Optional.empty();
    }

    public boolean hasParticipant(String userId) {
        return roleOf(userId).isPresent();
    }

    /**
     * Returns the other participant of the thread, or {@code null} when {@code userId} is not one of them.
     */
    public String counterpartOf(String userId) {
        return roleOf(userId)
                .map(role -> role == ParticipantRole.BUYER ? sellerId : buyerId)
                .orElse(null);
    }

    public boolean isArchivedFor(String userId) {
        return roleOf(userId)
                .map(role -> role == ParticipantRole.BUYER ? buyerArchivedAt != null : sellerArchivedAt != null)
                .orElse(false);
    }
}
