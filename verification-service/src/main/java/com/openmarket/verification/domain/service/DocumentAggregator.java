package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.DocumentStatus;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class DocumentAggregator {

    public DocumentCounts aggregate(Collection<BusinessDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return DocumentCounts.EMPTY;
        }
        int verified = 0;
        int pending = 0;
        int rejected = 0;
        int underReview = 0;
        for (BusinessDocument document : documents) {
            DocumentStatus status = document.getVerificationStatus();
            // An unset status counts as not yet looked at.
            if (status == null || status == DocumentStatus.PENDING) {
                pending++;
            } else if (status == DocumentStatus.VERIFIED) {
                verified++;
            } else if (status == DocumentStatus.REJECTED) {
                rejected++;
            } else {
                underReview++;
            }
        }
        return new DocumentCounts(documents.size(), verified, pending, rejected, underReview);
    }
}
