package com.example.negotiation.service.exception;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * Base of every failure the API maps to a status; the code falls back to the lower-cased status name.
 */
public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode != null ? errorCode : status.name().toLowerCase(Locale.ROOT);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Only collaborator outages are worth retrying; every other failure is a caller bug or a denial.
     */
    public boolean isRetryable() {
        return false;
    }
}
