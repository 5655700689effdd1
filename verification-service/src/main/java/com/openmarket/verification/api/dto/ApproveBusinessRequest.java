package com.openmarket.verification.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ApproveBusinessRequest(
        @NotBlank(message = "Approver is required")
        String approvedBy,

        String notes
) {
}
