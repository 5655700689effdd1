package com.openmarket.verification.orchestration;

import com.openmarket.verification.client.NotificationGateway;
import com.openmarket.verification.config.VerificationProperties;
import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.repository.BusinessRepository;
import com.openmarket.verification.domain.service.BusinessDecision;
import com.openmarket.verification.domain.service.DocumentDecision;
import com.openmarket.verification.domain.service.VerificationStateMachine;
import com.openmarket.verification.events.VerificationEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for admin verification decisions.
 * <p>
 * Flow:
 * 1. Apply the transition (own transaction, committed on return)
 * 2. Publish the decision event
 * 3. Notify the business owner for approvals and rejections
 * <p>
 * Deliberately not transactional: the decision is durable before anyone is notified, and a
 * notification problem only shows up as a warning next to the committed result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalOrchestrator {

    static final String BUSINESS_APPROVED = "business_approved";
    static final String BUSINESS_REJECTED = "business_rejected";
    static final String BUSINESS_DOCUMENT_REJECTED = "business_document_rejected";
    static final String OWNER_LOOKUP_FAILED = "Decision saved, but the business owner could not be looked up";

    private final VerificationStateMachine stateMachine;
    private final BusinessRepository businessRepository;
    private final NotificationGateway notificationGateway;
    private final VerificationEventPublisher eventPublisher;
    private final VerificationProperties properties;

    public BusinessDecisionResult approveBusiness(UUID businessId, String approvedBy, String notes) {
        BusinessDecision decision = stateMachine.approve(businessId, approvedBy, notes);
        eventPublisher.publishBusinessDecision(decision, decision.business().getApprovedBy());

        Business business = decision.business();
        Map<String, Object> variables = baseVariables(business);
        variables.put("approved_at", String.valueOf(business.getApprovedAt()));
        NotificationOutcome outcome = notifyOwner(business.getOwnerUserId(), BUSINESS_APPROVED,
                variables, metadata(business, null, "approve"));

        return new BusinessDecisionResult(decision, outcome, warnings(decision.warnings(), outcome));
    }

    public BusinessDecisionResult rejectBusiness(UUID businessId, String notes, String decidedBy) {
        BusinessDecision decision = stateMachine.reject(businessId, notes);
        eventPublisher.publishBusinessDecision(decision, decidedBy);

        Business business = decision.business();
        Map<String, Object> variables = baseVariables(business);
        variables.put("rejection_reason", business.getVerificationNotes());
        NotificationOutcome outcome = notifyOwner(business.getOwnerUserId(), BUSINESS_REJECTED,
                variables, metadata(business, null, "reject"));

        return new BusinessDecisionResult(decision, outcome, warnings(decision.warnings(), outcome));
    }

    public BusinessDecisionResult suspendBusiness(UUID businessId, String notes, String decidedBy) {
        BusinessDecision decision = stateMachine.suspend(businessId, notes);
        eventPublisher.publishBusinessDecision(decision, decidedBy);
        return new BusinessDecisionResult(decision, NotificationOutcome.SKIPPED, decision.warnings());
    }

    public BusinessDecisionResult resetBusinessToPending(UUID businessId, String notes, String decidedBy) {
        BusinessDecision decision = stateMachine.resetToPending(businessId, notes);
        eventPublisher.publishBusinessDecision(decision, decidedBy);
        return new BusinessDecisionResult(decision, NotificationOutcome.SKIPPED, decision.warnings());
    }

    public DocumentDecisionResult verifyDocument(UUID documentId, String verifiedBy) {
        DocumentDecision decision = stateMachine.verifyDocument(documentId, verifiedBy);
        List<String> warnings = publishDocumentDecision(decision, decision.document().getVerifiedBy());
        return new DocumentDecisionResult(decision, NotificationOutcome.SKIPPED, warnings);
    }

    public DocumentDecisionResult markDocumentUnderReview(UUID documentId, String decidedBy) {
        DocumentDecision decision = stateMachine.markDocumentUnderReview(documentId);
        List<String> warnings = publishDocumentDecision(decision, decidedBy);
        return new DocumentDecisionResult(decision, NotificationOutcome.SKIPPED, warnings);
    }

    public DocumentDecisionResult rejectDocument(UUID documentId, String reason, String decidedBy) {
        DocumentDecision decision = stateMachine.rejectDocument(documentId, reason);
        BusinessDocument document = decision.document();
        Business business;
        try {
            business = businessRepository.findById(document.getBusinessId()).orElse(null);
        } catch (RuntimeException e) {
            log.error("Document {} rejected but owner lookup for business {} failed, not notifying",
                    documentId, document.getBusinessId(), e);
            eventPublisher.publishDocumentDecision(decision, null, decidedBy);
            return new DocumentDecisionResult(decision, NotificationOutcome.UNAVAILABLE,
                    List.of(OWNER_LOOKUP_FAILED));
        }
        eventPublisher.publishDocumentDecision(decision, business != null ? business.getOwnerUserId() : null, decidedBy);

        if (business == null) {
            log.warn("Document {} rejected but business {} is gone, nobody to notify",
                    documentId, document.getBusinessId());
            return new DocumentDecisionResult(decision, NotificationOutcome.SKIPPED, List.of());
        }

        Map<String, Object> variables = baseVariables(business);
        variables.put("document_type", document.getDocumentType().getValue());
        variables.put("document_name", document.getDocumentName());
        variables.put("rejection_reason", document.getRejectionReason());
        NotificationOutcome outcome = notifyOwner(business.getOwnerUserId(), BUSINESS_DOCUMENT_REJECTED,
                variables, metadata(business, document, "reject_document"));

        return new DocumentDecisionResult(decision, outcome, warnings(List.of(), outcome));
    }

    private List<String> publishDocumentDecision(DocumentDecision decision, String decidedBy) {
        UUID businessId = decision.document().getBusinessId();
        try {
            String ownerUserId = businessRepository.findById(businessId)
                    .map(Business::getOwnerUserId)
                    .orElse(null);
            eventPublisher.publishDocumentDecision(decision, ownerUserId, decidedBy);
            return List.of();
        } catch (RuntimeException e) {
            log.error("Owner lookup for business {} failed, publishing document decision without owner",
                    businessId, e);
            eventPublisher.publishDocumentDecision(decision, null, decidedBy);
            return List.of(OWNER_LOOKUP_FAILED);
        }
    }

    private NotificationOutcome notifyOwner(String ownerUserId, String notificationType,
                                            Map<String, Object> variables, Map<String, Object> metadata) {
        if (!properties.getNotifications().isEnabled()) {
            log.debug("Decision notifications disabled, not sending {}", notificationType);
            return NotificationOutcome.SKIPPED;
        }
        try {
            return notificationGateway.notify(ownerUserId, notificationType, variables, metadata);
        } catch (RuntimeException e) {
            log.error("Notification {} to user {} failed after the decision was saved",
                    notificationType, ownerUserId, e);
            return NotificationOutcome.UNAVAILABLE;
        }
    }

    private static Map<String, Object> baseVariables(Business business) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("business_name", business.getDisplayName());
        variables.put("business_id", String.valueOf(business.getId()));
        return variables;
    }

    private static Map<String, Object> metadata(Business business, BusinessDocument document, String action) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("business_id", String.valueOf(business.getId()));
        metadata.put("action", action);
        if (document != null) {
            metadata.put("document_id", String.valueOf(document.getId()));
        }
        return metadata;
    }

    private static List<String> warnings(List<String> decisionWarnings, NotificationOutcome outcome) {
        List<String> warnings = new ArrayList<>(decisionWarnings);
        if (outcome.isProblem()) {
            String problem = switch (outcome) {
                case PARTIAL -> "was only partly delivered";
                case UNAVAILABLE -> "could not be sent: notification service unavailable";
                default -> "failed";
            };
            warnings.add("Decision saved, but the owner notification " + problem);
        }
        return warnings;
    }
}
