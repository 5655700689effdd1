package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.DocumentStatus;
import com.openmarket.verification.domain.model.DocumentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentAggregatorTest {

    private final DocumentAggregator aggregator = new DocumentAggregator();

    private static BusinessDocument doc(DocumentType type, DocumentStatus status) {
        return BusinessDocument.builder().documentType(type).verificationStatus(status).build();
    }

    @Test
    @DisplayName("counts each status and the partitions add up to total")
    void aggregate_mixed() {
        DocumentCounts counts = aggregator.aggregate(List.of(
                doc(DocumentType.BUSINESS_LICENSE, DocumentStatus.VERIFIED),
                doc(DocumentType.DRIVERS_LICENSE, DocumentStatus.VERIFIED),
                doc(DocumentType.PROOF_OF_ADDRESS, DocumentStatus.PENDING),
                doc(DocumentType.LIABILITY_INSURANCE, DocumentStatus.REJECTED),
                doc(DocumentType.PROFESSIONAL_LICENSE, DocumentStatus.UNDER_REVIEW),
                doc(DocumentType.PROFESSIONAL_CERTIFICATE, null)));

        assertThat(counts).isEqualTo(new DocumentCounts(6, 2, 2, 1, 1));
        assertThat(counts.verified() + counts.pending() + counts.rejected() + counts.underReview())
                .isEqualTo(counts.total());
        assertThat(counts.allVerified()).isFalse();
    }

    @Test
    @DisplayName("no documents yields all zeros")
    void aggregate_empty() {
        assertThat(aggregator.aggregate(List.of())).isEqualTo(DocumentCounts.EMPTY);
        assertThat(aggregator.aggregate(null)).isEqualTo(new DocumentCounts(0, 0, 0, 0, 0));
        assertThat(DocumentCounts.EMPTY.allVerified()).isFalse();
    }

    @Test
    @DisplayName("allVerified only when every document is verified")
    void aggregate_allVerified() {
        DocumentCounts counts = aggregator.aggregate(List.of(
                doc(DocumentType.BUSINESS_LICENSE, DocumentStatus.VERIFIED),
                doc(DocumentType.PROOF_OF_ADDRESS, DocumentStatus.VERIFIED)));

        assertThat(counts.allVerified()).isTrue();
    }
}
