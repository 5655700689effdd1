package com.openmarket.verification.api.dto;

import com.openmarket.verification.domain.model.Priority;
import com.openmarket.verification.domain.service.DocumentCounts;
import com.openmarket.verification.domain.service.VerificationSummary;

import java.util.List;

public record BusinessSummaryResponse(
        BusinessResponse business,
        Priority priority,
        DocumentCounts documentCounts,
        List<DocumentResponse> documents
) {
    public static BusinessSummaryResponse from(VerificationSummary summary) {
        return new BusinessSummaryResponse(
                BusinessResponse.from(summary.business()),
                summary.priority(),
                summary.documentCounts(),
                summary.documents().stream().map(DocumentResponse::from).toList()
        );
    }
}
