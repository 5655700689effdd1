package com.openmarket.verification.api.dto;

/**
 * Body of reject, suspend and reset calls. Whether notes are mandatory depends on the action.
 */
public record DecisionNotesRequest(
        String notes,
        String decidedBy
) {
}
