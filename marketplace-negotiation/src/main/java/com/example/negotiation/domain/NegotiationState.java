package com.example.negotiation.domain;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot obtained by folding a conversation's messages in sequence order.
 * The offer axis and the contact-share flag move independently.
 */
@Value
@Builder(toBuilder = true)
public class NegotiationState {

    private static final NegotiationState OPENED = NegotiationState.builder()
            .offerStatus(OfferStatus.OPENED)
            .contactShared(false)
            .build();

    OfferStatus offerStatus;
    boolean contactShared;
    BigDecimal latestOfferAmount;
    String latestOfferSenderId;
    Long latestOfferSequence;
    long foldedThroughSequence;

    public static NegotiationState opened() {
        return OPENED;
    }

    public boolean hasOffer() {
        return latestOfferSenderId != null;
    }
}
