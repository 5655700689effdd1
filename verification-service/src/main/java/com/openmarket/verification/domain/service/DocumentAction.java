package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.DocumentStatus;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

import static com.openmarket.verification.domain.model.DocumentStatus.*;

/**
 * Admin decisions on a single document, with the statuses each one may start from.
 */
@Getter
public enum DocumentAction {
    VERIFY("verify", VERIFIED, EnumSet.of(PENDING, UNDER_REVIEW, REJECTED)),
    REJECT("reject", REJECTED, EnumSet.of(PENDING, UNDER_REVIEW, VERIFIED)),
    MARK_UNDER_REVIEW("mark under review", UNDER_REVIEW, EnumSet.of(PENDING, REJECTED, VERIFIED));

    private final String verb;
    private final DocumentStatus target;
    private final Set<DocumentStatus> allowedFrom;

    DocumentAction(String verb, DocumentStatus target, Set<DocumentStatus> allowedFrom) {
        this.verb = verb;
        this.target = target;
        this.allowedFrom = allowedFrom;
    }

    public boolean allows(DocumentStatus from) {
        return allowedFrom.contains(from);
    }
}
