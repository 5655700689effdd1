package com.openmarket.verification.orchestration;

import com.openmarket.verification.domain.service.DocumentDecision;

import java.util.List;

public record DocumentDecisionResult(
        DocumentDecision decision,
        NotificationOutcome notification,
        List<String> warnings
) {
}
