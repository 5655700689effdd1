package com.openmarket.verification.orchestration;

/**
 * What happened to the notification that followed a decision. Never affects the decision itself.
 */
public enum NotificationOutcome {
    /** Every attempted channel was handed to its provider. */
    SENT,
    /** Some channels went out, others failed. */
    PARTIAL,
    FAILED,
    /** Owner is in quiet hours. */
    SUPPRESSED,
    /** Nothing to send: no owner, no enabled channel, or notifications switched off. */
    SKIPPED,
    /** notification-service could not be reached or its circuit is open. */
    UNAVAILABLE;

    public boolean isProblem() {
        return this == FAILED || this == PARTIAL || this == UNAVAILABLE;
    }
}
