package com.openmarket.notification.transport;

/**
 * Why a transport could not hand a message over. Logged, never thrown.
 */
public record TransportError(String provider, String message) {

    public static TransportError from(String provider, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TransportError(provider, message);
    }
}
