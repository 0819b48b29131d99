package com.example.negotiation.persistence;

import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.MessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "negotiation_messages",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_message_conversation_seq", columnNames = {"conversation_id", "seq_no"}))
public class MessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Column(name = "seq_no", nullable = false, updatable = false)
    private long sequence;

    @Column(name = "sender_id", nullable = false, updatable = false, length = 128)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, updatable = false, length = 32)
    private MessageType type;

    @Column(name = "body", updatable = false, columnDefinition = "text")
    private String body;

    @Column(name = "offer_amount", updatable = false,
            precision = ChatMessage.OFFER_AMOUNT_PRECISION, scale = ChatMessage.OFFER_AMOUNT_SCALE)
    private BigDecimal offerAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
