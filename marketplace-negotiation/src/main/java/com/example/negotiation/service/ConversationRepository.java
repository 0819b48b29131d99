package com.example.negotiation.service;

import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.ReadMarker;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for conversation threads, their append-only message logs and per-participant read markers.
 */
public interface ConversationRepository {

    Optional<ConversationMetadata> getConversation(String conversationId);

    Optional<ConversationMetadata> findByProductAndBuyer(String productId, String buyerId);

    /**
     * Inserts a new thread. A concurrent insert for the same (product, buyer) pair surfaces as
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    ConversationMetadata insertConversation(ConversationMetadata conversation);

    /**
     * Assigns the next sequence number to {@code draft} and stores it. Counter increment, message insert and
     * last-activity update commit together or not at all.
     */
    ChatMessage appendMessage(ChatMessage draft);

    List<ChatMessage> getMessagesAfter(String conversationId, long afterSequence, int limit);

    /**
     * Latest {@code limit} messages in ascending sequence order.
     */
    List<ChatMessage> getLatestMessages(String conversationId, int limit);

    List<ChatMessage> getAllMessages(String conversationId);

    List<ConversationMetadata> findForParticipant(String userId, boolean includeArchived, int page, int size);

    ConversationMetadata updateArchive(String conversationId, String userId, Instant archivedAt);

    Optional<ReadMarker> getReadMarker(String conversationId, String userId);

    /**
     * Moves the markers forward to the given positions; markers never move backwards.
     */
    ReadMarker advanceReadMarker(
            String conversationId, String userId, long readUpTo, long deliveredUpTo, Instant updatedAt);

    long countMessagesFromOthersAfter(String conversationId, String userId, long afterSequence);
}
