package com.openmarket.notification.transport;

public interface SmsTransport {

    TransportResult send(String to, String body);
}
