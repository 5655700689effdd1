package com.openmarket.verification.api.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyDocumentRequest(
        @NotBlank(message = "Verifier is required")
        String verifiedBy
) {
}
