package com.example.negotiation.service;

import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.ReadMarker;
import com.example.negotiation.event.ConversationLifecycleEvent;
import com.example.negotiation.event.ChatEventPublisher;
import com.example.negotiation.event.LifecycleEventType;
import com.example.negotiation.event.MessageDeliveryEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Tells recipients that something is waiting for them and keeps the per-participant read and delivered
 * markers. Notification is at-least-once: a delivery event may repeat, never precede its commit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryNotifier {

    private final ConversationRepository conversationRepository;
    private final ChatEventPublisher eventPublisher;
    private final ConversationLocks conversationLocks;
    private final RedisKeyFactory keyFactory;
    private final Clock clock;

    /**
     * Signals the recipient of a stored message. Deferred until the surrounding transaction commits, if any;
     * dropped on rollback.
     */
    public void onAppended(ConversationMetadata conversation, ChatMessage message) {
        String recipientId = conversation.counterpartOf(message.getSenderId());
        if (recipientId == null) {
            throw new IllegalArgumentException("Sender %s is not a participant of conversation %s"
                    .formatted(message.getSenderId(), conversation.getId()));
        }
        Runnable emit = () -> {
            try {
                emitDelivery(conversation, message, recipientId);
            } catch (RuntimeException ex) {
                log.warn("Failed to notify {} of message {} in conversation {}", recipientId, message.getSequence(),
                        conversation.getId(), ex);
            }
        };
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    emit.run();
                }
            });
        } else {
            emit.run();
        }
    }

    public ReadMarker markRead(ConversationMetadata conversation, String userId, long uptoSequence) {
        long target = clamp(uptoSequence, conversation.getLastSequence());
        return conversationLocks.withLock(keyFactory.readMarkerLockKey(conversation.getId(), userId), () -> {
            long previous = conversationRepository.getReadMarker(conversation.getId(), userId)
                    .map(ReadMarker::getLastReadSequence)
                    .orElse(0L);
            ReadMarker marker = conversationRepository.advanceReadMarker(
                    conversation.getId(), userId, target, target, Instant.now(clock));
            if (marker.getLastReadSequence() > previous) {
                eventPublisher.publishLifecycleEvent(ConversationLifecycleEvent.of(
                        LifecycleEventType.MESSAGES_READ, conversation.getId(), userId, marker.getUpdatedAt(),
                        Map.of("lastReadSequence", marker.getLastReadSequence())));
            }
            return marker;
        });
    }

    public ReadMarker markDelivered(ConversationMetadata conversation, String userId, long uptoSequence) {
        long target = clamp(uptoSequence, conversation.getLastSequence());
        return conversationLocks.withLock(keyFactory.readMarkerLockKey(conversation.getId(), userId),
                () -> conversationRepository.advanceReadMarker(
                        conversation.getId(), userId, 0L, target, Instant.now(clock)));
    }

    public ReadMarker getMarker(ConversationMetadata conversation, String userId) {
        return conversationRepository.getReadMarker(conversation.getId(), userId)
                .orElseGet(() -> ReadMarker.builder()
                        .conversationId(conversation.getId())
                        .userId(userId)
                        .build());
    }

    public long unreadCount(ConversationMetadata conversation, String userId) {
        long lastRead = getMarker(conversation, userId).getLastReadSequence();
        if (lastRead >= conversation.getLastSequence()) {
            return 0L;
        }
        return conversationRepository.countMessagesFromOthersAfter(conversation.getId(), userId, lastRead);
    }

    private void emitDelivery(ConversationMetadata conversation, ChatMessage message, String recipientId) {
        long lastRead = getMarker(conversation, recipientId).getLastReadSequence();
        long unread = conversationRepository.countMessagesFromOthersAfter(conversation.getId(), recipientId, lastRead);
        MessageDeliveryEvent event = MessageDeliveryEvent.builder()
                .eventId(conversation.getId() + ":" + message.getSequence())
                .conversationId(conversation.getId())
                .productId(conversation.getProductId())
                .recipientId(recipientId)
                .senderId(message.getSenderId())
                .sequence(message.getSequence())
                .messageType(message.getType())
                .recipientUnreadCount(unread)
                .occurredAt(message.getCreatedAt())
                .build();
        log.debug("Notifying {} of message {} in conversation {}", recipientId, message.getSequence(),
                conversation.getId());
        eventPublisher.publishDeliveryEvent(event);
    }

    private static long clamp(long requested, long lastSequence) {
        return Math.max(0L, Math.min(requested, lastSequence));
    }
}
