package com.example.negotiation.service.exception;

import org.springframework.http.HttpStatus;

public class DependencyUnavailableException extends ServiceException {

    public DependencyUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, "dependency_unavailable", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
