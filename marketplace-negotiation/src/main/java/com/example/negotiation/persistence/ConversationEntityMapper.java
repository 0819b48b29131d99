package com.example.negotiation.persistence;

import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.ReadMarker;
import org.springframework.stereotype.Component;

@Component
public class ConversationEntityMapper {

    public ConversationEntity toEntity(ConversationMetadata metadata) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(metadata.getId());
        entity.setProductId(metadata.getProductId());
        entity.setBuyerId(metadata.getBuyerId());
        entity.setSellerId(metadata.getSellerId());
        entity.setCreatedAt(metadata.getCreatedAt());
        entity.setLastActivityAt(metadata.getLastActivityAt() != null
                ? metadata.getLastActivityAt()
                : metadata.getCreatedAt());
        entity.setLastSequence(metadata.getLastSequence());
        entity.setBuyerArchivedAt(metadata.getBuyerArchivedAt());
        entity.setSellerArchivedAt(metadata.getSellerArchivedAt());
        entity.setVersion(metadata.getVersion());
        return entity;
    }

    public ConversationMetadata toMetadata(ConversationEntity entity) {
        if (entity == null) {
            return null;
        }
        return ConversationMetadata.builder()
                .id(entity.getId())
                .productId(entity.getProductId())
                .buyerId(entity.getBuyerId())
                .sellerId(entity.getSellerId())
                .createdAt(entity.getCreatedAt())
                .lastActivityAt(entity.getLastActivityAt())
                .lastSequence(entity.getLastSequence())
                .buyerArchivedAt(entity.getBuyerArchivedAt())
                .sellerArchivedAt(entity.getSellerArchivedAt())
                .version(entity.getVersion())
                .build();
    }

    public MessageEntity toEntity(ChatMessage message) {
        MessageEntity entity = new MessageEntity();
        entity.setId(message.getId());
        entity.setConversationId(message.getConversationId());
        entity.setSequence(message.getSequence());
        entity.setSenderId(message.getSenderId());
        entity.setType(message.getType());
        entity.setBody(message.getBody());
        entity.setOfferAmount(message.getOfferAmount());
        entity.setCreatedAt(message.getCreatedAt());
        return entity;
    }

    public ChatMessage toMessage(MessageEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatMessage.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .sequence(entity.getSequence())
                .senderId(entity.getSenderId())
                .type(entity.getType())
                .body(entity.getBody())
                .offerAmount(entity.getOfferAmount())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ReadMarker toReadMarker(ReadMarkerEntity entity) {
        if (entity == null) {
            return null;
        }
        return ReadMarker.builder()
                .conversationId(entity.getConversationId())
                .userId(entity.getUserId())
                .lastReadSequence(entity.getLastReadSequence())
                .lastDeliveredSequence(entity.getLastDeliveredSequence())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
