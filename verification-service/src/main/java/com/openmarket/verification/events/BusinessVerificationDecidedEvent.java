package com.openmarket.verification.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event published after a verification decision has been committed.
 * subjectType is "business" or "document"; documentId is set only for document decisions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessVerificationDecidedEvent {
    private String businessId;
    private String ownerUserId;
    private String subjectType;
    private String documentId;
    private String action;
    private String previousStatus;
    private String status;
    private String decidedBy;
    private String notes;
    private Instant timestamp;
}
