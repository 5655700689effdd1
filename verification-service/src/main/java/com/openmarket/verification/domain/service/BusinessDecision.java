package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.VerificationStatus;

import java.util.List;

/**
 * A committed business transition plus advisory warnings that did not block it.
 */
public record BusinessDecision(
        Business business,
        BusinessAction action,
        VerificationStatus previousStatus,
        List<String> warnings
) {
}
