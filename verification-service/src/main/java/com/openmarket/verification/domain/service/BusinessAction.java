package com.openmarket.verification.domain.service;

import com.openmarket.verification.domain.model.VerificationStatus;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

import static com.openmarket.verification.domain.model.VerificationStatus.*;

/**
 * Admin decisions on a business, with the statuses each one may start from.
 */
@Getter
public enum BusinessAction {
    APPROVE("approve", APPROVED, EnumSet.of(PENDING, REJECTED, SUSPENDED)),
    REJECT("reject", REJECTED, EnumSet.of(PENDING, SUSPENDED)),
    SUSPEND("suspend", SUSPENDED, EnumSet.of(PENDING, APPROVED)),
    RESET_TO_PENDING("reset to pending", PENDING, EnumSet.of(APPROVED, REJECTED, SUSPENDED));

    private final String verb;
    private final VerificationStatus target;
    private final Set<VerificationStatus> allowedFrom;

    BusinessAction(String verb, VerificationStatus target, Set<VerificationStatus> allowedFrom) {
        this.verb = verb;
        this.target = target;
        this.allowedFrom = allowedFrom;
    }

    public boolean allows(VerificationStatus from) {
        return allowedFrom.contains(from);
    }
}
