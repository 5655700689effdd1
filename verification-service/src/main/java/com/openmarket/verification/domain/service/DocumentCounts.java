package com.openmarket.verification.domain.service;

/**
 * Per-status document counts of one business. The four partitions always sum to total.
 */
public record DocumentCounts(
        int total,
        int verified,
        int pending,
        int rejected,
        int underReview
) {
    public static final DocumentCounts EMPTY = new DocumentCounts(0, 0, 0, 0, 0);

    public boolean allVerified() {
        return total > 0 && verified == total;
    }
}
