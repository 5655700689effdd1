package com.openmarket.verification.domain.service;

import com.openmarket.common.exception.ResourceNotFoundException;
import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.model.Priority;
import com.openmarket.verification.domain.model.VerificationStatus;
import com.openmarket.verification.domain.repository.BusinessDocumentRepository;
import com.openmarket.verification.domain.repository.BusinessRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the admin review queue: businesses with document counts and priority,
 * most urgent first and oldest application first within a priority.
 */
@Service
@RequiredArgsConstructor
public class VerificationQueryService {

    private static final Comparator<VerificationSummary> QUEUE_ORDER =
            Comparator.comparing(VerificationSummary::priority)
                    .thenComparing(summary -> submittedAt(summary.business()),
                            Comparator.nullsLast(Comparator.naturalOrder()));

    private final BusinessRepository businessRepository;
    private final BusinessDocumentRepository documentRepository;
    private final DocumentAggregator documentAggregator;
    private final PriorityClassifier priorityClassifier;

    @Transactional(readOnly = true)
    public List<VerificationSummary> listBusinesses(VerificationStatus status, Priority priority) {
        List<Business> businesses = status != null
                ? businessRepository.findByVerificationStatus(status)
                : businessRepository.findAll();
        if (businesses.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<BusinessDocument>> documentsByBusiness = documentRepository
                .findByBusinessIdIn(businesses.stream().map(Business::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(BusinessDocument::getBusinessId));

        return businesses.stream()
                .map(business -> summarize(business, documentsByBusiness.getOrDefault(business.getId(), List.of())))
                .filter(summary -> priority == null || summary.priority() == priority)
                .sorted(QUEUE_ORDER)
                .toList();
    }

    @Transactional(readOnly = true)
    public VerificationSummary getBusiness(UUID businessId) {
        Business business = businessRepository.findById(businessId)
                .orElseThrow(() -> new ResourceNotFoundException("Business", businessId));
        return summarize(business, documentRepository.findByBusinessId(businessId));
    }

    private VerificationSummary summarize(Business business, List<BusinessDocument> documents) {
        return new VerificationSummary(business, documents,
                documentAggregator.aggregate(documents),
                priorityClassifier.classify(business));
    }

    private static LocalDateTime submittedAt(Business business) {
        return business.getApplicationSubmittedAt() != null
                ? business.getApplicationSubmittedAt()
                : business.getCreatedAt();
    }
}
