package com.example.negotiation.persistence;

import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.ParticipantRole;
import com.example.negotiation.domain.ReadMarker;
import com.example.negotiation.service.ConversationRepository;
import com.example.negotiation.service.exception.ConversationNotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaConversationRepository implements ConversationRepository {

    private final ConversationJpaRepository conversationJpaRepository;
    private final MessageJpaRepository messageJpaRepository;
    private final ReadMarkerJpaRepository readMarkerJpaRepository;
    private final ConversationEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationMetadata> getConversation(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return conversationJpaRepository.findById(conversationId).map(mapper::toMetadata);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationMetadata> findByProductAndBuyer(String productId, String buyerId) {
        return conversationJpaRepository.findByProductIdAndBuyerId(productId, buyerId).map(mapper::toMetadata);
    }

    @Override
    @Transactional
    public ConversationMetadata insertConversation(ConversationMetadata conversation) {
        ConversationEntity entity = mapper.toEntity(conversation);
        entity.setVersion(null);
        entity.setLastSequence(0);
        ConversationEntity saved = conversationJpaRepository.saveAndFlush(entity);
        return mapper.toMetadata(saved);
    }

    @Override
    @Transactional
    public ChatMessage appendMessage(ChatMessage draft) {
        ConversationEntity conversation = conversationJpaRepository
                .findByIdForUpdate(draft.getConversationId())
                .orElseThrow(() -> ConversationNotFoundException.forConversation(draft.getConversationId()));

        long sequence = conversation.getLastSequence() + 1;
        MessageEntity message = mapper.toEntity(draft);
        message.setSequence(sequence);
        entityManager.persist(message);

        conversation.setLastSequence(sequence);
        if (conversation.getLastActivityAt() == null || draft.getCreatedAt().isAfter(conversation.getLastActivityAt())) {
            conversation.setLastActivityAt(draft.getCreatedAt());
        }
        conversation.setBuyerArchivedAt(null);
        conversation.setSellerArchivedAt(null);
        entityManager.flush();

        return mapper.toMessage(message);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> getMessagesAfter(String conversationId, long afterSequence, int limit) {
        if (!StringUtils.hasText(conversationId) || limit <= 0) {
            return Collections.emptyList();
        }
        return messageJpaRepository
                .findByConversationIdAndSequenceGreaterThanOrderBySequenceAsc(
                        conversationId, Math.max(afterSequence, 0), PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> getLatestMessages(String conversationId, int limit) {
        if (!StringUtils.hasText(conversationId) || limit <= 0) {
            return Collections.emptyList();
        }
        List<ChatMessage> newestFirst = messageJpaRepository
                .findByConversationIdOrderBySequenceDesc(conversationId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMessage)
                .toList();
        List<ChatMessage> ascending = new ArrayList<>(newestFirst);
        Collections.reverse(ascending);
        return Collections.unmodifiableList(ascending);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> getAllMessages(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Collections.emptyList();
        }
        return messageJpaRepository.findByConversationIdOrderBySequenceAsc(conversationId).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMetadata> findForParticipant(String userId, boolean includeArchived, int page, int size) {
        if (!StringUtils.hasText(userId) || size <= 0) {
            return Collections.emptyList();
        }
        return conversationJpaRepository
                .findForParticipant(userId, includeArchived, PageRequest.of(Math.max(page, 0), size))
                .stream()
                .map(mapper::toMetadata)
                .toList();
    }

    @Override
    @Transactional
    public ConversationMetadata updateArchive(String conversationId, String userId, Instant archivedAt) {
        ConversationEntity entity = conversationJpaRepository
                .findByIdForUpdate(conversationId)
                .orElseThrow(() -> ConversationNotFoundException.forConversation(conversationId));
        ParticipantRole role = mapper.toMetadata(entity)
                .roleOf(userId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "User %s does not take part in conversation %s".formatted(userId, conversationId)));
        if (role == ParticipantRole.BUYER) {
            entity.setBuyerArchivedAt(archivedAt);
        } else {
            entity.setSellerArchivedAt(archivedAt);
        }
        entityManager.flush();
        return mapper.toMetadata(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ReadMarker> getReadMarker(String conversationId, String userId) {
        return readMarkerJpaRepository
                .findById(new ReadMarkerId(conversationId, userId))
                .map(mapper::toReadMarker);
    }

    @Override
    @Transactional
    public ReadMarker advanceReadMarker(
            String conversationId, String userId, long readUpTo, long deliveredUpTo, Instant updatedAt) {
        ReadMarkerEntity marker = readMarkerJpaRepository
                .findForUpdate(conversationId, userId)
                .orElseGet(() -> {
                    ReadMarkerEntity created = new ReadMarkerEntity();
                    created.setConversationId(conversationId);
                    created.setUserId(userId);
                    entityManager.persist(created);
                    return created;
                });
        long read = Math.max(marker.getLastReadSequence(), readUpTo);
        marker.setLastReadSequence(read);
        marker.setLastDeliveredSequence(Math.max(Math.max(marker.getLastDeliveredSequence(), deliveredUpTo), read));
        marker.setUpdatedAt(updatedAt);
        entityManager.flush();
        return mapper.toReadMarker(marker);
    }

    @Override
    @Transactional(readOnly = true)
    public long countMessagesFromOthersAfter(String conversationId, String userId, long afterSequence) {
        return messageJpaRepository.countByConversationIdAndSequenceGreaterThanAndSenderIdNot(
                conversationId, afterSequence, userId);
    }
}
