package com.openmarket.verification.domain.service;

import com.openmarket.common.exception.InvalidTransitionException;
import com.openmarket.common.exception.ResourceNotFoundException;
import com.openmarket.common.exception.ValidationException;
import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.DocumentStatus;
import com.openmarket.verification.domain.model.VerificationStatus;
import com.openmarket.verification.domain.repository.BusinessDocumentRepository;
import com.openmarket.verification.domain.repository.BusinessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies admin verification decisions to businesses and documents.
 * <p>
 * Every operation checks its input, the record's existence and the transition table before
 * touching anything, so a rejected call leaves the record exactly as it was.
 * Notifying the owner is not done here; see
 * {@link com.openmarket.verification.orchestration.ApprovalOrchestrator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationStateMachine {

    /** Matches the notes and rejection reason column widths. */
    public static final int MAX_NOTES_LENGTH = 2000;

    private final BusinessRepository businessRepository;
    private final BusinessDocumentRepository documentRepository;
    private final Clock clock;

    public static boolean canTransition(VerificationStatus from, VerificationStatus to, BusinessAction action) {
        return action.getTarget() == to && action.allows(from);
    }

    public static boolean canTransition(DocumentStatus from, DocumentStatus to, DocumentAction action) {
        return action.getTarget() == to && action.allows(from);
    }

    /**
     * Approves a business. Documents that are not verified yet produce a warning but do not block.
     */
    @Transactional
    public BusinessDecision approve(UUID businessId, String approvedBy, String notes) {
        String approver = require(approvedBy, "Approver is required");
        limit(notes, "Notes");
        Business business = loadBusiness(businessId);
        VerificationStatus previous = checkTransition(business, BusinessAction.APPROVE);

        List<String> warnings = unverifiedDocumentWarnings(businessId);

        business.setVerificationStatus(VerificationStatus.APPROVED);
        business.setApprovedAt(LocalDateTime.now(clock));
        business.setApprovedBy(approver);
        if (StringUtils.hasText(notes)) {
            business.setVerificationNotes(notes.trim());
        }
        Business saved = businessRepository.save(business);

        log.info("Business {} approved by {} (was {}){}", businessId, approver, previous.getValue(),
                warnings.isEmpty() ? "" : " with warnings: " + warnings);
        return new BusinessDecision(saved, BusinessAction.APPROVE, previous, warnings);
    }

    @Transactional
    public BusinessDecision reject(UUID businessId, String notes) {
        return applyWithNotes(businessId, BusinessAction.REJECT,
                limit(require(notes, "Rejection notes are required"), "Rejection notes"));
    }

    @Transactional
    public BusinessDecision suspend(UUID businessId, String notes) {
        return applyWithNotes(businessId, BusinessAction.SUSPEND,
                limit(require(notes, "Suspension notes are required"), "Suspension notes"));
    }

    @Transactional
    public BusinessDecision resetToPending(UUID businessId, String notes) {
        return applyWithNotes(businessId, BusinessAction.RESET_TO_PENDING,
                StringUtils.hasText(notes) ? limit(notes.trim(), "Notes") : null);
    }

    @Transactional
    public DocumentDecision verifyDocument(UUID documentId, String verifiedBy) {
        String verifier = require(verifiedBy, "Verifier is required");
        BusinessDocument document = loadDocument(documentId);
        DocumentStatus previous = checkTransition(document, DocumentAction.VERIFY);

        document.setVerificationStatus(DocumentStatus.VERIFIED);
        document.setVerifiedBy(verifier);
        document.setVerifiedAt(LocalDateTime.now(clock));
        document.setRejectionReason(null);
        return saveDocument(document, DocumentAction.VERIFY, previous);
    }

    @Transactional
    public DocumentDecision rejectDocument(UUID documentId, String reason) {
        String rejectionReason = limit(require(reason, "Rejection reason is required"), "Rejection reason");
        BusinessDocument document = loadDocument(documentId);
        DocumentStatus previous = checkTransition(document, DocumentAction.REJECT);

        document.setVerificationStatus(DocumentStatus.REJECTED);
        document.setRejectionReason(rejectionReason);
        document.setVerifiedBy(null);
        document.setVerifiedAt(null);
        return saveDocument(document, DocumentAction.REJECT, previous);
    }

    @Transactional
    public DocumentDecision markDocumentUnderReview(UUID documentId) {
        BusinessDocument document = loadDocument(documentId);
        DocumentStatus previous = checkTransition(document, DocumentAction.MARK_UNDER_REVIEW);

        document.setVerificationStatus(DocumentStatus.UNDER_REVIEW);
        document.setRejectionReason(null);
        document.setVerifiedBy(null);
        document.setVerifiedAt(null);
        return saveDocument(document, DocumentAction.MARK_UNDER_REVIEW, previous);
    }

    private BusinessDecision applyWithNotes(UUID businessId, BusinessAction action, String notes) {
        Business business = loadBusiness(businessId);
        VerificationStatus previous = checkTransition(business, action);

        business.setVerificationStatus(action.getTarget());
        if (notes != null) {
            business.setVerificationNotes(notes);
        }
        Business saved = businessRepository.save(business);

        log.info("Business {} moved {} -> {}", businessId, previous.getValue(), action.getTarget().getValue());
        return new BusinessDecision(saved, action, previous, List.of());
    }

    private DocumentDecision saveDocument(BusinessDocument document, DocumentAction action, DocumentStatus previous) {
        BusinessDocument saved = documentRepository.save(document);
        log.info("Document {} ({}) of business {} moved {} -> {}", document.getId(),
                document.getDocumentType().getValue(), document.getBusinessId(),
                previous.getValue(), action.getTarget().getValue());
        return new DocumentDecision(saved, action, previous);
    }

    private List<String> unverifiedDocumentWarnings(UUID businessId) {
        List<BusinessDocument> documents = documentRepository.findByBusinessId(businessId);
        if (documents.isEmpty()) {
            return List.of("No verification documents uploaded");
        }
        String unverified = documents.stream()
                .filter(doc -> doc.getVerificationStatus() != DocumentStatus.VERIFIED)
                .map(doc -> doc.getDocumentType().getValue() + " (" + statusOf(doc).getValue() + ")")
                .collect(Collectors.joining(", "));
        return unverified.isEmpty() ? List.of() : List.of("Unverified documents: " + unverified);
    }

    private static DocumentStatus statusOf(BusinessDocument document) {
        return document.getVerificationStatus() != null ? document.getVerificationStatus() : DocumentStatus.PENDING;
    }

    private VerificationStatus checkTransition(Business business, BusinessAction action) {
        VerificationStatus from = business.getVerificationStatus() != null
                ? business.getVerificationStatus()
                : VerificationStatus.PENDING;
        if (!canTransition(from, action.getTarget(), action)) {
            throw new InvalidTransitionException("business", business.getId(), from.getValue(), action.getVerb());
        }
        return from;
    }

    private DocumentStatus checkTransition(BusinessDocument document, DocumentAction action) {
        DocumentStatus from = statusOf(document);
        if (!canTransition(from, action.getTarget(), action)) {
            throw new InvalidTransitionException("document", document.getId(), from.getValue(), action.getVerb());
        }
        return from;
    }

    private Business loadBusiness(UUID businessId) {
        if (businessId == null) {
            throw new ValidationException("Business ID is required");
        }
        return businessRepository.findById(businessId)
                .orElseThrow(() -> new ResourceNotFoundException("Business", businessId));
    }

    private BusinessDocument loadDocument(UUID documentId) {
        if (documentId == null) {
            throw new ValidationException("Document ID is required");
        }
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new ResourceNotFoundException("Document", documentId));
    }

    private static String require(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(message);
        }
        return value.trim();
    }

    private static String limit(String value, String field) {
        if (value != null && value.trim().length() > MAX_NOTES_LENGTH) {
            throw new ValidationException(field + " must be at most " + MAX_NOTES_LENGTH + " characters");
        }
        return value;
    }
}
