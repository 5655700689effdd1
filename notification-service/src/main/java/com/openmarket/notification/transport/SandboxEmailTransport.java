package com.openmarket.notification.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Logs instead of sending. Used when no email provider is configured.
 */
@Slf4j
public class SandboxEmailTransport implements EmailTransport {

    @Override
    public TransportResult send(String to, String subject, String html, String text) {
        String id = "sandbox-" + UUID.randomUUID();
        log.info("[sandbox] email '{}' accepted, id={}", subject, id);
        return TransportResult.sent(id);
    }
}
