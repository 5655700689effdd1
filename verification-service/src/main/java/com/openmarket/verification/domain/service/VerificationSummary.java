package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.Priority;

import java.util.List;

/**
 * A business as the review queue shows it: the record, its documents and derived fields.
 */
public record VerificationSummary(
        Business business,
        List<BusinessDocument> documents,
        DocumentCounts documentCounts,
        Priority priority
) {
}
