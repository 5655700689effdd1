package com.openmarket.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DocumentStatus {
    PENDING("pending"),
    VERIFIED("verified"),
    REJECTED("rejected"),
    UNDER_REVIEW("under_review");

    @JsonValue
    private final String value;
}
