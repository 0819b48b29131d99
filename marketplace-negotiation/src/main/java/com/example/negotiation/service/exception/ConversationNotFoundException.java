package com.example.negotiation.service.exception;

import org.springframework.http.HttpStatus;

public class ConversationNotFoundException extends ServiceException {

    private ConversationNotFoundException(String message, String errorCode) {
        super(HttpStatus.NOT_FOUND, message, errorCode);
    }

    public static ConversationNotFoundException forConversation(String conversationId) {
        return new ConversationNotFoundException(
                "Conversation %s not found".formatted(conversationId), "conversation_not_found");
    }

    public static ConversationNotFoundException forProduct(String productId) {
        return new ConversationNotFoundException(
                "Product %s not found".formatted(productId), "product_not_found");
    }
}
