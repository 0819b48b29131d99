package com.example.negotiation.service;

import com.example.negotiation.config.NegotiationProperties;
import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.MessageType;
import com.example.negotiation.domain.NegotiationState;
import com.example.negotiation.domain.OfferStatus;
import com.example.negotiation.service.exception.InvalidPayloadException;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Interprets message payloads. Holds no state of its own: the negotiation state of a conversation is always
 * recomputed from its message log in sequence order.
 */
@Component
@RequiredArgsConstructor
public class NegotiationEngine {

    static final int MAX_OFFER_FRACTION_DIGITS = ChatMessage.OFFER_AMOUNT_SCALE;
    static final int MAX_OFFER_INTEGER_DIGITS = ChatMessage.OFFER_AMOUNT_PRECISION - ChatMessage.OFFER_AMOUNT_SCALE;

    private final NegotiationProperties properties;

    /**
     * Checks a candidate message against the rules of its type.
     *
     * @throws InvalidPayloadException when the payload does not fit the type
     */
    public void validate(MessageType type, String body, BigDecimal offerAmount) {
        if (type == null) {
            throw new InvalidPayloadException("Message type is required");
        }
        int maxBodyLength = properties.getMessages().getMaxBodyLength();
        if (body != null && body.length() > maxBodyLength) {
            throw new InvalidPayloadException("Message body exceeds %d characters".formatted(maxBodyLength));
        }
        switch (type) {
            case TEXT -> {
                if (!StringUtils.hasText(body)) {
                    throw new InvalidPayloadException("Text messages require a non-empty body");
                }
                requireNoAmount(type, offerAmount);
            }
            case CONTACT_SHARE -> requireNoAmount(type, offerAmount);
            case OFFER -> validateOfferAmount(offerAmount);
        }
    }

    public NegotiationState apply(NegotiationState state, ChatMessage message) {
        if (message.getSequence() <= state.getFoldedThroughSequence()) {
            throw new IllegalStateException("Message %d applied out of order after %d"
                    .formatted(message.getSequence(), state.getFoldedThroughSequence()));
        }
        NegotiationState.NegotiationStateBuilder next = state.toBuilder()
                .foldedThroughSequence(message.getSequence());
        if (message.getType() == MessageType.CONTACT_SHARE) {
            next.contactShared(true);
        } else if (message.getType() == MessageType.OFFER) {
            OfferStatus status = !state.hasOffer() || state.getLatestOfferSenderId().equals(message.getSenderId())
                    ? OfferStatus.OFFER_PENDING
                    : OfferStatus.COUNTERED;
            next.offerStatus(status)
                    .latestOfferAmount(message.getOfferAmount())
                    .latestOfferSenderId(message.getSenderId())
                    .latestOfferSequence(message.getSequence());
        }
        return next.build();
    }

    public NegotiationState fold(List<ChatMessage> messages) {
        NegotiationState state = NegotiationState.opened();
        if (messages == null || messages.isEmpty()) {
            return state;
        }
        List<ChatMessage> ordered = messages.stream()
                .sorted(Comparator.comparingLong(ChatMessage::getSequence))
                .toList();
        for (ChatMessage message : ordered) {
            state = apply(state, message);
        }
        return state;
    }

    private void validateOfferAmount(BigDecimal offerAmount) {
        if (offerAmount == null) {
            throw new InvalidPayloadException("Offers require an amount");
        }
        if (offerAmount.signum() <= 0) {
            throw new InvalidPayloadException("Offer amount must be greater than zero");
        }
        BigDecimal normalized = offerAmount.stripTrailingZeros();
        if (normalized.scale() > MAX_OFFER_FRACTION_DIGITS) {
            throw new InvalidPayloadException(
                    "Offer amount supports at most %d fraction digits".formatted(MAX_OFFER_FRACTION_DIGITS));
        }
        if (normalized.precision() - normalized.scale() > MAX_OFFER_INTEGER_DIGITS) {
            throw new InvalidPayloadException(
                    "Offer amount supports at most %d integer digits".formatted(MAX_OFFER_INTEGER_DIGITS));
        }
    }

    private void requireNoAmount(MessageType type, BigDecimal offerAmount) {
        if (offerAmount != null) {
            throw new InvalidPayloadException(
                    "Messages of type %s cannot carry an offer amount".formatted(type.getWireName()));
        }
    }
}
