package com.openmarket.notification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Channel {
    EMAIL("email"),
    SMS("sms");

    private final String value;

    Channel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
