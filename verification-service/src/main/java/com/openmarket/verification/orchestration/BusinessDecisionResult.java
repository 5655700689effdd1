package com.openmarket.verification.orchestration;

import com.openmarket.verification.domain.service.BusinessDecision;

import java.util.List;

/**
 * Outcome of a business decision as seen by the admin: the committed change,
 * what happened to the owner notification, and every non-fatal warning.
 */
public record BusinessDecisionResult(
        BusinessDecision decision,
        NotificationOutcome notification,
        List<String> warnings
) {
}
