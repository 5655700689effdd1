package com.openmarket.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openmarket.common.exception.ValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Review urgency of a business in the admin queue. Declared most urgent first.
 */
@Getter
@RequiredArgsConstructor
public enum Priority {
    URGENT("urgent"),
    HIGH("high"),
    NORMAL("normal");

    @JsonValue
    private final String value;

    public static Priority fromValue(String value) {
        for (Priority candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new ValidationException("Unknown priority: " + value);
    }
}
