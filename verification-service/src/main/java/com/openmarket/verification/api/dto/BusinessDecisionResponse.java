package com.openmarket.verification.api.dto;

import com.openmarket.verification.domain.model.VerificationStatus;
import com.openmarket.verification.orchestration.BusinessDecisionResult;
import com.openmarket.verification.orchestration.NotificationOutcome;

public record BusinessDecisionResponse(
        BusinessResponse business,
        VerificationStatus previousStatus,
        NotificationOutcome notification
) {
    public static BusinessDecisionResponse from(BusinessDecisionResult result) {
        return new BusinessDecisionResponse(
                BusinessResponse.from(result.decision().business()),
                result.decision().previousStatus(),
                result.notification()
        );
    }
}
