package com.example.negotiation.domain;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    /**
     * Offer amounts are stored as {@code NUMERIC(19, 2)}.
     */
    public static final int OFFER_AMOUNT_PRECISION = 19;
    public static final int OFFER_AMOUNT_SCALE = 2;

    private String id;
    private String conversationId;
    private long sequence;
    private String senderId;
    private MessageType type;
    private String body;
    private BigDecimal offerAmount;
    private Instant createdAt;
}
