package com.openmarket.verification.events;

import com.openmarket.common.util.Topics;
import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.BusinessDocument;
import com.openmarket.verification.domain.service.BusinessDecision;
import com.openmarket.verification.domain.service.DocumentDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes committed verification decisions for analytics and search indexing.
 * Fire-and-forget: a failed publish is logged and the decision stands.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishBusinessDecision(BusinessDecision decision, String decidedBy) {
        Business business = decision.business();
        BusinessVerificationDecidedEvent event = BusinessVerificationDecidedEvent.builder()
                .businessId(String.valueOf(business.getId()))
                .ownerUserId(business.getOwnerUserId())
                .subjectType("business")
                .action(decision.action().getVerb())
                .previousStatus(decision.previousStatus().getValue())
                .status(business.getVerificationStatus().getValue())
                .decidedBy(decidedBy)
                .notes(business.getVerificationNotes())
                .timestamp(clock.instant())
                .build();

        publishEvent(event.getBusinessId(), event);
    }

    public void publishDocumentDecision(DocumentDecision decision, String ownerUserId, String decidedBy) {
        BusinessDocument document = decision.document();
        BusinessVerificationDecidedEvent event = BusinessVerificationDecidedEvent.builder()
                .businessId(String.valueOf(document.getBusinessId()))
                .ownerUserId(ownerUserId)
                .subjectType("document")
                .documentId(String.valueOf(document.getId()))
                .action(decision.action().getVerb())
                .previousStatus(decision.previousStatus().getValue())
                .status(document.getVerificationStatus().getValue())
                .decidedBy(decidedBy)
                .notes(document.getRejectionReason())
                .timestamp(clock.instant())
                .build();

        publishEvent(event.getBusinessId(), event);
    }

    private void publishEvent(String key, BusinessVerificationDecidedEvent event) {
        log.info("Publishing {} {} decision for business {} to topic {}",
                event.getSubjectType(), event.getAction(), key, Topics.BUSINESS_VERIFICATION_DECIDED);
        try {
            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(Topics.BUSINESS_VERIFICATION_DECIDED, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Decision event for business {} published: offset={}",
                            key, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish decision event for business {}", key, ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish decision event for business {}", key, e);
        }
    }
}
