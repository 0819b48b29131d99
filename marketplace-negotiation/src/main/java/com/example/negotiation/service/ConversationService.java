package com.example.negotiation.service;

import com.example.negotiation.config.NegotiationProperties;
import com.example.negotiation.domain.AuthenticatedUser;
import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.MessageType;
import com.example.negotiation.domain.NegotiationState;
import com.example.negotiation.domain.ParticipantRole;
import com.example.negotiation.domain.ReadMarker;
import com.example.negotiation.dto.ConversationDetail;
import com.example.negotiation.dto.ConversationSummary;
import com.example.negotiation.event.ConversationLifecycleEvent;
import com.example.negotiation.event.ChatEventPublisher;
import com.example.negotiation.event.LifecycleEventType;
import com.example.negotiation.service.AccessController.Action;
import com.example.negotiation.service.exception.ConversationNotFoundException;
import com.example.negotiation.service.exception.ForbiddenException;
import com.example.negotiation.service.exception.ServiceException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationRepository conversationRepository;
    private final NegotiationEngine negotiationEngine;
    private final AccessController accessController;
    private final DeliveryNotifier deliveryNotifier;
    private final SellerOfRecordResolver sellerResolver;
    private final ChatEventPublisher eventPublisher;
    private final ConversationLocks conversationLocks;
    private final RedisKeyFactory keyFactory;
    private final NegotiationProperties properties;
    private final Clock clock;

    public ConversationMetadata getOrCreateConversation(AuthenticatedUser buyer, String productId) {
        accessController.requireVerified(buyer);
        if (!StringUtils.hasText(productId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Product id is required");
        }
        String buyerId = buyer.userId();
        Optional<ConversationMetadata> existing = conversationRepository.findByProductAndBuyer(productId, buyerId);
        if (existing.isPresent()) {
            return existing.get();
        }

        String sellerId = sellerResolver.requireSeller(productId);
        if (sellerId.equals(buyerId)) {
            throw new ForbiddenException("Sellers cannot open a conversation on their own product %s"
                    .formatted(productId));
        }

        return conversationLocks.withLock(keyFactory.conversationCreationLockKey(productId, buyerId),
                () -> conversationRepository.findByProductAndBuyer(productId, buyerId)
                        .orElseGet(() -> createConversation(productId, buyerId, sellerId)));
    }

    public List<ConversationSummary> listConversations(
            AuthenticatedUser user, boolean includeArchived, int page, int size) {
        accessController.requireAuthenticated(user);
        int resolvedSize = clamp(size, properties.getConversations().getMaxPageSize());
        return conversationRepository.findForParticipant(user.userId(), includeArchived, Math.max(page, 0), resolvedSize)
                .stream()
                .map(conversation -> toSummary(conversation, user.userId()))
                .toList();
    }

    /**
     * Opens a thread: summary, negotiation state and the latest messages. Everything returned is marked read.
     */
    public ConversationDetail openConversation(AuthenticatedUser user, String conversationId) {
        accessController.requireAuthenticated(user);
        ConversationMetadata conversation = loadConversation(conversationId);
        accessController.authorize(user.userId(), conversation, Action.READ);

        List<ChatMessage> latest = conversationRepository.getLatestMessages(
                conversationId, properties.getConversations().getDetailMessageLimit());
        ReadMarker marker;
        if (latest.isEmpty()) {
            marker = deliveryNotifier.getMarker(conversation, user.userId());
        } else {
            long lastShown = latest.get(latest.size() - 1).getSequence();
            marker = deliveryNotifier.markRead(refreshed(conversation, lastShown), user.userId(), lastShown);
        }

        return ConversationDetail.builder()
                .conversation(toSummary(conversation, user.userId()))
                .messages(latest)
                .readMarker(marker)
                .build();
    }

    public ChatMessage postMessage(
            AuthenticatedUser sender, String conversationId, MessageType type, String body, BigDecimal offerAmount) {
        accessController.requireVerified(sender);
        ConversationMetadata conversation = loadConversation(conversationId);
        accessController.authorize(sender.userId(), conversation, Action.WRITE);
        MessageType resolvedType = type == null ? MessageType.TEXT : type;
        negotiationEngine.validate(resolvedType, body, offerAmount);

        ChatMessage draft = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversationId)
                .senderId(sender.userId())
                .type(resolvedType)
                .body(StringUtils.hasText(body) ? body.trim() : null)
                .offerAmount(offerAmount)
                .createdAt(Instant.now(clock))
                .build();

        ChatMessage stored = conversationLocks.withLock(keyFactory.conversationAppendLockKey(conversationId),
                () -> conversationRepository.appendMessage(draft));
        log.debug("Stored {} message {} in conversation {}", stored.getType().getWireName(), stored.getSequence(),
                conversationId);

        deliveryNotifier.onAppended(conversation, stored);
        return stored;
    }

    /**
     * Polling read. Advances the caller's delivered marker up to the last message returned.
     */
    public List<ChatMessage> getMessages(
            AuthenticatedUser user, String conversationId, long afterSequence, Integer limit) {
        accessController.requireAuthenticated(user);
        if (limit != null && limit < 1) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message limit must be at least 1");
        }
        ConversationMetadata conversation = loadConversation(conversationId);
        accessController.authorize(user.userId(), conversation, Action.READ);

        int requested = limit == null ? properties.getMessages().getDefaultPageSize() : limit;
        List<ChatMessage> messages = conversationRepository.getMessagesAfter(
                conversationId, Math.max(afterSequence, 0L), clamp(requested, properties.getMessages().getMaxPageSize()));
        if (!messages.isEmpty()) {
            long lastReturned = messages.get(messages.size() - 1).getSequence();
            deliveryNotifier.markDelivered(refreshed(conversation, lastReturned), user.userId(), lastReturned);
        }
        return messages;
    }

    public ReadMarker markRead(AuthenticatedUser user, String conversationId, long uptoSequence) {
        accessController.requireAuthenticated(user);
        ConversationMetadata conversation = loadConversation(conversationId);
        accessController.authorize(user.userId(), conversation, Action.READ);
        return deliveryNotifier.markRead(conversation, user.userId(), uptoSequence);
    }

    public ConversationSummary archive(AuthenticatedUser user, String conversationId) {
        return updateArchive(user, conversationId, true);
    }

    public ConversationSummary unarchive(AuthenticatedUser user, String conversationId) {
        return updateArchive(user, conversationId, false);
    }

    public NegotiationState getNegotiationState(AuthenticatedUser user, String conversationId) {
        accessController.requireAuthenticated(user);
        ConversationMetadata conversation = loadConversation(conversationId);
        accessController.authorize(user.userId(), conversation, Action.READ);
        return negotiationEngine.fold(conversationRepository.getAllMessages(conversationId));
    }

    private ConversationMetadata createConversation(String productId, String buyerId, String sellerId) {
        Instant now = Instant.now(clock);
        ConversationMetadata draft = ConversationMetadata.builder()
                .id(UUID.randomUUID().toString())
                .productId(productId)
                .buyerId(buyerId)
                .sellerId(sellerId)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        ConversationMetadata created;
        try {
            created = conversationRepository.insertConversation(draft);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Lost creation race for product {} and buyer {}", productId, buyerId);
            return conversationRepository.findByProductAndBuyer(productId, buyerId).orElseThrow(() -> ex);
        }
        log.info("Started conversation {} on product {} between buyer {} and seller {}",
                created.getId(), productId, buyerId, sellerId);

        eventPublisher.publishLifecycleEvent(ConversationLifecycleEvent.of(
                LifecycleEventType.CONVERSATION_STARTED, created.getId(), buyerId, now,
                Map.of("productId", productId, "buyerId", buyerId, "sellerId", sellerId)));
        return created;
    }

    private ConversationSummary updateArchive(AuthenticatedUser user, String conversationId, boolean archived) {
        accessController.requireAuthenticated(user);
        ConversationMetadata conversation = loadConversation(conversationId);
        ParticipantRole role = accessController.authorize(user.userId(), conversation, Action.READ);
        Instant now = Instant.now(clock);
        ConversationMetadata updated = conversationRepository.updateArchive(
                conversationId, user.userId(), archived ? now : null);
        log.info("Conversation {} {} by {} {}", conversationId, archived ? "archived" : "unarchived",
                role.name().toLowerCase(), user.userId());

        LifecycleEventType type = archived
                ? LifecycleEventType.CONVERSATION_ARCHIVED
                : LifecycleEventType.CONVERSATION_UNARCHIVED;
        eventPublisher.publishLifecycleEvent(ConversationLifecycleEvent.of(
                type, conversationId, user.userId(), now, Map.of("role", role.name())));
        return toSummary(updated, user.userId());
    }

    private ConversationSummary toSummary(ConversationMetadata conversation, String userId) {
        ParticipantRole role = conversation.roleOf(userId).orElse(null);
        return ConversationSummary.builder()
                .id(conversation.getId())
                .productId(conversation.getProductId())
                .buyerId(conversation.getBuyerId())
                .sellerId(conversation.getSellerId())
                .role(role)
                .counterpartId(conversation.counterpartOf(userId))
                .createdAt(conversation.getCreatedAt())
                .lastActivityAt(conversation.getLastActivityAt())
                .lastSequence(conversation.getLastSequence())
                .archived(conversation.isArchivedFor(userId))
                .unreadCount(deliveryNotifier.unreadCount(conversation, userId))
                .negotiation(negotiationEngine.fold(conversationRepository.getAllMessages(conversation.getId())))
                .build();
    }

    private ConversationMetadata loadConversation(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Conversation id is required");
        }
        return conversationRepository.getConversation(conversationId)
                .orElseThrow(() -> ConversationNotFoundException.forConversation(conversationId));
    }

    /**
     * Messages may have landed between loading the conversation and reading its log; widen the snapshot so the
     * marker clamp accepts everything the caller has actually seen.
     */
    private static ConversationMetadata refreshed(ConversationMetadata conversation, long seenSequence) {
        if (seenSequence <= conversation.getLastSequence()) {
            return conversation;
        }
        return conversation.toBuilder().lastSequence(seenSequence).build();
    }

    private static int clamp(int requested, int max) {
        return Math.max(1, Math.min(requested, max));
    }
}
