package com.openmarket.notification.transport;

/**
 * Outcome of one send: either the provider's message id or a {@link TransportError}.
 */
public record TransportResult(String externalId, TransportError error) {

    public static TransportResult sent(String externalId) {
        return new TransportResult(externalId, null);
    }

    public static TransportResult failed(TransportError error) {
        return new TransportResult(null, error);
    }

    public boolean isSent() {
        return error == null;
    }

    public String errorMessage() {
        return error != null ? error.message() : null;
    }
}
