package com.openmarket.verification.api.dto;

import com.openmarket.verification.domain.model.DocumentStatus;
import com.openmarket.verification.orchestration.DocumentDecisionResult;
import com.openmarket.verification.orchestration.NotificationOutcome;

public record DocumentDecisionResponse(
        DocumentResponse document,
        DocumentStatus previousStatus,
        NotificationOutcome notification
) {
    public static DocumentDecisionResponse from(DocumentDecisionResult result) {
        return new DocumentDecisionResponse(
                DocumentResponse.from(result.decision().document()),
                result.decision().previousStatus(),
                result.notification()
        );
    }
}
