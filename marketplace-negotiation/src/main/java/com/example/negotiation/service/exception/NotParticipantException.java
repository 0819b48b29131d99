package com.example.negotiation.service.exception;

import org.springframework.http.HttpStatus;

public class NotParticipantException extends ServiceException {

    public NotParticipantException(String userId, String conversationId) {
        super(HttpStatus.FORBIDDEN,
                "User %s is not a participant of conversation %s".formatted(userId, conversationId),
                "not_participant");
    }
}
