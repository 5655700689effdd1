package com.openmarket.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openmarket.common.exception.ValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum VerificationStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    SUSPENDED("suspended");

    @JsonValue
    private final String value;

    public static VerificationStatus fromValue(String value) {
        for (VerificationStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new ValidationException("Unknown verification status: " + value);
    }
}
