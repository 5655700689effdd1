package com.openmarket.notification.transport;

public interface EmailTransport {

    /**
     * Hands one email to the provider. Implementations report provider errors in the result;
     * callers still guard against runtime exceptions.
     *
     * @param text plain-text alternative, may be null
     */
    TransportResult send(String to, String subject, String html, String text);
}
