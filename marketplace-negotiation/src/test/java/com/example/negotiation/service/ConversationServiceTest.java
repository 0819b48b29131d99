package com.example.negotiation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.negotiation.config.NegotiationProperties;
import com.example.negotiation.config.NegotiationSecurityProperties;
import com.example.negotiation.domain.AuthenticatedUser;
import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.MessageType;
import com.example.negotiation.domain.NegotiationState;
import com.example.negotiation.domain.OfferStatus;
import com.example.negotiation.dto.ConversationSummary;
import com.example.negotiation.event.ConversationLifecycleEvent;
import com.example.negotiation.event.ChatEventPublisher;
import com.example.negotiation.event.LifecycleEventType;
import com.example.negotiation.service.exception.ConversationNotFoundException;
import com.example.negotiation.service.exception.DependencyUnavailableException;
import com.example.negotiation.service.exception.ForbiddenException;
import com.example.negotiation.service.exception.InvalidPayloadException;
import com.example.negotiation.service.exception.NotParticipantException;
import com.example.negotiation.service.exception.ServiceException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationService")
class ConversationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final AuthenticatedUser BUYER = new AuthenticatedUser("buyer-1", true);
    private static final AuthenticatedUser SELLER = new AuthenticatedUser("seller-1", true);
    private static final AuthenticatedUser STRANGER = new AuthenticatedUser("stranger", true);

    @Mock
    private ConversationRepository conversationRepository;

    @Mock
    private DeliveryNotifier deliveryNotifier;

    @Mock
    private SellerOfRecordResolver sellerResolver;

    @Mock
    private ChatEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<ConversationLifecycleEvent> lifecycleCaptor;

    private NegotiationProperties properties;
    private NegotiationSecurityProperties securityProperties;
    private ConversationService service;
    private ConversationMetadata conversation;

    @BeforeEach
    void setUp() {
        properties = new NegotiationProperties();
        securityProperties = new NegotiationSecurityProperties();
        service = new ConversationService(
                conversationRepository,
                new NegotiationEngine(properties),
                new AccessController(securityProperties),
                deliveryNotifier,
                sellerResolver,
                eventPublisher,
                new InMemoryConversationLocks(),
                new RedisKeyFactory(properties),
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        conversation = ConversationMetadata.builder()
                .id("c-1")
                .productId("p-1")
                .buyerId("buyer-1")
                .sellerId("seller-1")
                .createdAt(NOW)
                .lastActivityAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("getOrCreateConversation")
    class GetOrCreate {

        @Test
        @DisplayName("returns the existing thread without asking the listing registry")
        void returnsExisting() {
            when(conversationRepository.findByProductAndBuyer("p-1", "buyer-1")).thenReturn(Optional.of(conversation));

            ConversationMetadata result = service.getOrCreateConversation(BUYER, "p-1");

            assertThat(result).isSameAs(conversation);
            verify(sellerResolver, never()).requireSeller(anyString());
            verify(conversationRepository, never()).insertConversation(any());
        }

        @Test
        @DisplayName("creates a thread with the seller of record and announces it")
        void createsConversation() {
            // Given
            when(conversationRepository.findByProductAndBuyer("p-1", "buyer-1")).thenReturn(Optional.empty());
            when(sellerResolver.requireSeller("p-1")).thenReturn("seller-1");
            when(conversationRepository.insertConversation(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            ConversationMetadata created = service.getOrCreateConversation(BUYER, "p-1");

            // Then
            assertThat(created.getId()).isNotBlank();
            assertThat(created.getSellerId()).isEqualTo("seller-1");
            assertThat(created.getBuyerId()).isEqualTo("buyer-1");
            assertThat(created.getCreatedAt()).isEqualTo(NOW);
            verify(eventPublisher).publishLifecycleEvent(lifecycleCaptor.capture());
            assertThat(lifecycleCaptor.getValue().getType()).isEqualTo(LifecycleEventType.CONVERSATION_STARTED);
            assertThat(lifecycleCaptor.getValue().getConversationId()).isEqualTo(created.getId());
        }

        @Test
        @DisplayName("refuses a seller contacting themself")
        void sellerCannotBuyOwnProduct() {
            when(conversationRepository.findByProductAndBuyer("p-1", "seller-1")).thenReturn(Optional.empty());
            when(sellerResolver.requireSeller("p-1")).thenReturn("seller-1");

            assertThatThrownBy(() -> service.getOrCreateConversation(SELLER, "p-1"))
                    .isInstanceOf(ForbiddenException.class);
            verify(conversationRepository, never()).insertConversation(any());
        }

        @Test
        @DisplayName("surfaces a registry outage and creates nothing")
        void registryOutage() {
            when(conversationRepository.findByProductAndBuyer("p-1", "buyer-1")).thenReturn(Optional.empty());
            when(sellerResolver.requireSeller("p-1"))
                    .thenThrow(new DependencyUnavailableException("timed out", null));

            assertThatThrownBy(() -> service.getOrCreateConversation(BUYER, "p-1"))
                    .isInstanceOf(DependencyUnavailableException.class);
            verify(conversationRepository, never()).insertConversation(any());
            verify(eventPublisher, never()).publishLifecycleEvent(any());
        }

        @Test
        @DisplayName("surfaces an unknown product as not found")
        void unknownProduct() {
            when(conversationRepository.findByProductAndBuyer("p-x", "buyer-1")).thenReturn(Optional.empty());
            when(sellerResolver.requireSeller("p-x")).thenThrow(ConversationNotFoundException.forProduct("p-x"));

            assertThatThrownBy(() -> service.getOrCreateConversation(BUYER, "p-x"))
                    .isInstanceOf(ConversationNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "product_not_found");
        }

        @Test
        @DisplayName("returns the winner when another instance inserted first")
        void lostRaceReturnsWinner() {
            // Given
            when(conversationRepository.findByProductAndBuyer("p-1", "buyer-1"))
                    .thenReturn(Optional.empty(), Optional.empty(), Optional.of(conversation));
            when(sellerResolver.requireSeller("p-1")).thenReturn("seller-1");
            when(conversationRepository.insertConversation(any()))
                    .thenThrow(new DataIntegrityViolationException("uk_conversation_product_buyer"));

            // When
            ConversationMetadata result = service.getOrCreateConversation(BUYER, "p-1");

            // Then
            assertThat(result).isSameAs(conversation);
            verify(eventPublisher, never()).publishLifecycleEvent(any());
        }

        @Test
        @DisplayName("refuses unverified buyers when verification is required")
        void requiresVerification() {
            securityProperties.setRequireVerifiedForWrites(true);

            assertThatThrownBy(() -> service.getOrCreateConversation(new AuthenticatedUser("buyer-1", false), "p-1"))
                    .isInstanceOf(ForbiddenException.class);
            verify(conversationRepository, never()).findByProductAndBuyer(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("postMessage")
    class PostMessage {

        @Test
        @DisplayName("stores the message before notifying the recipient")
        void appendsThenNotifies() {
            // Given
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.appendMessage(any())).thenAnswer(invocation -> {
                ChatMessage draft = invocation.getArgument(0);
                draft.setSequence(1);
                return draft;
            });

            // When
            ChatMessage stored = service.postMessage(BUYER, "c-1", MessageType.OFFER, null, new BigDecimal("5000"));

            // Then
            assertThat(stored.getSequence()).isEqualTo(1L);
            assertThat(stored.getSenderId()).isEqualTo("buyer-1");
            assertThat(stored.getOfferAmount()).isEqualByComparingTo("5000");
            InOrder order = inOrder(conversationRepository, deliveryNotifier);
            order.verify(conversationRepository).appendMessage(any());
            order.verify(deliveryNotifier).onAppended(conversation, stored);
        }

        @Test
        @DisplayName("defaults a missing type to text and trims the body")
        void defaultsToText() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.appendMessage(any())).thenAnswer(invocation -> invocation.getArgument(0));

            ChatMessage stored = service.postMessage(SELLER, "c-1", null, "  still available  ", null);

            assertThat(stored.getType()).isEqualTo(MessageType.TEXT);
            assertThat(stored.getBody()).isEqualTo("still available");
        }

        @Test
        @DisplayName("rejects outsiders before anything is stored")
        void rejectsOutsider() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));

            assertThatThrownBy(() -> service.postMessage(STRANGER, "c-1", MessageType.TEXT, "hi", null))
                    .isInstanceOf(NotParticipantException.class);
            verify(conversationRepository, never()).appendMessage(any());
            verify(deliveryNotifier, never()).onAppended(any(), any());
        }

        @Test
        @DisplayName("rejects invalid offers before anything is stored")
        void rejectsInvalidOffer() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));

            assertThatThrownBy(() -> service.postMessage(BUYER, "c-1", MessageType.OFFER, null, new BigDecimal("-1")))
                    .isInstanceOf(InvalidPayloadException.class);
            verify(conversationRepository, never()).appendMessage(any());
            verify(deliveryNotifier, never()).onAppended(any(), any());
        }

        @Test
        @DisplayName("fails on an unknown conversation")
        void unknownConversation() {
            when(conversationRepository.getConversation("c-404")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.postMessage(BUYER, "c-404", MessageType.TEXT, "hi", null))
                    .isInstanceOf(ConversationNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "conversation_not_found");
        }

        @Test
        @DisplayName("does not notify when the store fails")
        void noNotificationOnFailure() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.appendMessage(any())).thenThrow(new IllegalStateException("lock timeout"));

            assertThatThrownBy(() -> service.postMessage(BUYER, "c-1", MessageType.TEXT, "hi", null))
                    .isInstanceOf(IllegalStateException.class);
            verify(deliveryNotifier, never()).onAppended(any(), any());
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("clamps the page size and records delivery up to the last message returned")
        void getMessagesClampsLimit() {
            // Given
            conversation.setLastSequence(2);
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.getMessagesAfter("c-1", 0L, 200))
                    .thenReturn(List.of(stored(1, "buyer-1"), stored(2, "buyer-1")));

            // When
            List<ChatMessage> messages = service.getMessages(SELLER, "c-1", -4, 10_000);

            // Then
            assertThat(messages).extracting(ChatMessage::getSequence).containsExactly(1L, 2L);
            verify(deliveryNotifier).markDelivered(conversation, "seller-1", 2L);
        }

        @Test
        @DisplayName("rejects a page limit below one instead of widening it")
        void getMessagesRejectsNonPositiveLimit() {
            assertThatThrownBy(() -> service.getMessages(BUYER, "c-1", 3, 0))
                    .isInstanceOf(ServiceException.class)
                    .hasFieldOrPropertyWithValue("status", HttpStatus.BAD_REQUEST)
                    .hasFieldOrPropertyWithValue("errorCode", "bad_request");
            assertThatThrownBy(() -> service.getMessages(BUYER, "c-1", 3, -5))
                    .isInstanceOf(ServiceException.class);

            verify(conversationRepository, never()).getMessagesAfter(anyString(), anyLong(), anyInt());
            verify(deliveryNotifier, never()).markDelivered(any(), anyString(), anyLong());
        }

        @Test
        @DisplayName("a limit of one returns a single message")
        void getMessagesLimitOfOne() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.getMessagesAfter("c-1", 0L, 1)).thenReturn(List.of(stored(1, "buyer-1")));

            assertThat(service.getMessages(SELLER, "c-1", 0, 1)).hasSize(1);
        }

        @Test
        @DisplayName("falls back to the default page size")
        void getMessagesDefaultLimit() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.getMessagesAfter("c-1", 0L, 50)).thenReturn(List.of());

            assertThat(service.getMessages(BUYER, "c-1", 0, null)).isEmpty();
        }

        @Test
        @DisplayName("forbids outsiders from reading")
        void outsidersCannotRead() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));

            assertThatThrownBy(() -> service.getMessages(STRANGER, "c-1", 0, 10))
                    .isInstanceOf(ForbiddenException.class);
            verify(conversationRepository, never()).getMessagesAfter(anyString(), anyLong(), eq(10));
        }

        @Test
        @DisplayName("derives the negotiation state from the stored log")
        void negotiationStateIsFolded() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.getAllMessages("c-1")).thenReturn(List.of(
                    offer(1, "seller-1", "5000"), offer(2, "buyer-1", "4500")));

            NegotiationState state = service.getNegotiationState(BUYER, "c-1");

            assertThat(state.getOfferStatus()).isEqualTo(OfferStatus.COUNTERED);
            assertThat(state.getLatestOfferAmount()).isEqualByComparingTo("4500");
        }

        @Test
        @DisplayName("lists conversations with the caller's view of each")
        void listsForCaller() {
            conversation.setLastSequence(3);
            when(conversationRepository.findForParticipant("seller-1", false, 0, 100)).thenReturn(List.of(conversation));
            when(conversationRepository.getAllMessages("c-1")).thenReturn(List.of(offer(1, "buyer-1", "100")));
            when(deliveryNotifier.unreadCount(conversation, "seller-1")).thenReturn(3L);

            List<ConversationSummary> summaries = service.listConversations(SELLER, false, -1, 500);

            assertThat(summaries).singleElement().satisfies(summary -> {
                assertThat(summary.getCounterpartId()).isEqualTo("buyer-1");
                assertThat(summary.getUnreadCount()).isEqualTo(3L);
                assertThat(summary.getNegotiation().getOfferStatus()).isEqualTo(OfferStatus.OFFER_PENDING);
            });
        }
    }

    @Nested
    @DisplayName("archive")
    class Archive {

        @Test
        @DisplayName("archives for the caller only and announces it")
        void archives() {
            ConversationMetadata archived = conversation.toBuilder().sellerArchivedAt(NOW).build();
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.updateArchive("c-1", "seller-1", NOW)).thenReturn(archived);
            when(conversationRepository.getAllMessages("c-1")).thenReturn(List.of());

            ConversationSummary summary = service.archive(SELLER, "c-1");

            assertThat(summary.isArchived()).isTrue();
            verify(eventPublisher).publishLifecycleEvent(lifecycleCaptor.capture());
            assertThat(lifecycleCaptor.getValue().getType()).isEqualTo(LifecycleEventType.CONVERSATION_ARCHIVED);
        }

        @Test
        @DisplayName("clears the caller's flag on unarchive")
        void unarchives() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));
            when(conversationRepository.updateArchive("c-1", "buyer-1", null)).thenReturn(conversation);
            when(conversationRepository.getAllMessages("c-1")).thenReturn(List.of());

            ConversationSummary summary = service.unarchive(BUYER, "c-1");

            assertThat(summary.isArchived()).isFalse();
            verify(eventPublisher).publishLifecycleEvent(lifecycleCaptor.capture());
            assertThat(lifecycleCaptor.getValue().getType()).isEqualTo(LifecycleEventType.CONVERSATION_UNARCHIVED);
        }

        @Test
        @DisplayName("forbids outsiders")
        void outsidersCannotArchive() {
            when(conversationRepository.getConversation("c-1")).thenReturn(Optional.of(conversation));

            assertThatThrownBy(() -> service.archive(STRANGER, "c-1")).isInstanceOf(ForbiddenException.class);
            verify(conversationRepository, never()).updateArchive(anyString(), anyString(), any());
        }
    }

    private static ChatMessage stored(long sequence, String sender) {
        return ChatMessage.builder()
                .id("m-" + sequence)
                .conversationId("c-1")
                .sequence(sequence)
                .senderId(sender)
                .type(MessageType.TEXT)
                .body("hello")
                .createdAt(NOW)
                .build();
    }

    private static ChatMessage offer(long sequence, String sender, String amount) {
        return ChatMessage.builder()
                .id("m-" + sequence)
                .conversationId("c-1")
                .sequence(sequence)
                .senderId(sender)
                .type(MessageType.OFFER)
                .offerAmount(new BigDecimal(amount))
                .createdAt(NOW)
                .build();
    }
}
