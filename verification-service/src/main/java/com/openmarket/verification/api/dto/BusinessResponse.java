package com.openmarket.verification.api.dto;

import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.VerificationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record BusinessResponse(
        UUID id,
        String displayName,
        String contactEmail,
        String phone,
        String ownerUserId,
        VerificationStatus verificationStatus,
        LocalDateTime applicationSubmittedAt,
        LocalDateTime approvedAt,
        String approvedBy,
        String verificationNotes,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BusinessResponse from(Business business) {
        return new BusinessResponse(
                business.getId(),
                business.getDisplayName(),
                business.getContactEmail(),
                business.getPhone(),
                business.getOwnerUserId(),
                business.getVerificationStatus(),
                business.getApplicationSubmittedAt(),
                business.getApprovedAt(),
                business.getApprovedBy(),
                business.getVerificationNotes(),
                business.getCreatedAt(),
                business.getUpdatedAt()
        );
    }
}
