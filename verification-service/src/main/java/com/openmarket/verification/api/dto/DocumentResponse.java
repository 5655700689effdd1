package com.openmarket.verification.api.dto;

import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.DocumentStatus;
import com.openmarket.verification.domain.model.DocumentType;

import java.time.LocalDateTime;
import java.util.UUID;

public record DocumentResponse(
        UUID id,
        UUID businessId,
        DocumentType documentType,
        String documentName,
        DocumentStatus verificationStatus,
        String rejectionReason,
        String verifiedBy,
        LocalDateTime verifiedAt,
        LocalDateTime createdAt
) {
    public static DocumentResponse from(BusinessDocument document) {
        return new DocumentResponse(
                document.getId(),
                document.getBusinessId(),
                document.getDocumentType(),
                document.getDocumentName(),
                document.getVerificationStatus(),
                document.getRejectionReason(),
                document.getVerifiedBy(),
                document.getVerifiedAt(),
                document.getCreatedAt()
        );
    }
}
