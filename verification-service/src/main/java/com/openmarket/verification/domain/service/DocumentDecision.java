package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.DocumentStatus;

public record DocumentDecision(
        BusinessDocument document,
        DocumentAction action,
        DocumentStatus previousStatus
) {
}
