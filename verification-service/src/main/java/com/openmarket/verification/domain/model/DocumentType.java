package com.openmarket.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Documents a business can upload for verification.
 */
@Getter
@RequiredArgsConstructor
public enum DocumentType {
    DRIVERS_LICENSE("drivers_license"),
    PROOF_OF_ADDRESS("proof_of_address"),
    LIABILITY_INSURANCE("liability_insurance"),
    PROFESSIONAL_LICENSE("professional_license"),
    PROFESSIONAL_CERTIFICATE("professional_certificate"),
    BUSINESS_LICENSE("business_license");

    @JsonValue
    private final String value;
}
