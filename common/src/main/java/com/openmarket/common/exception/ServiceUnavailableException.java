package com.openmarket.common.exception;

/**
 * Thrown when a required dependency (e.g. the identity service) is temporarily unavailable.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
