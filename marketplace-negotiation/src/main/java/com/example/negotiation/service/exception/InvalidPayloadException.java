package com.example.negotiation.service.exception;

import org.springframework.http.HttpStatus;

public class InvalidPayloadException extends ServiceException {

    public InvalidPayloadException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, message, "invalid_payload");
    }
}
