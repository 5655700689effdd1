package com.openmarket.notification.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

@Slf4j
public class SandboxSmsTransport implements SmsTransport {

    @Override
    public TransportResult send(String to, String body) {
        String id = "sandbox-" + UUID.randomUUID();
        log.info("[sandbox] SMS of {} chars accepted, id={}", body.length(), id);
        return TransportResult.sent(id);
    }
}
