package com.openmarket.verification.domain.service;

import com.openmarket.verification.config.VerificationProperties;
import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.Priority;
import com.openmarket.verification.domain.model.VerificationStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Derives the review priority of a business. Never persisted.
 * <p>
 * Suspended businesses are always urgent. Pending ones escalate with the age of their
 * application, counted in started days (3 days and 1 minute counts as 4).
 */
@Component
@RequiredArgsConstructor
public class PriorityClassifier {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;
    private final VerificationProperties properties;

    public Priority classify(Business business) {
        return classify(business.getVerificationStatus(),
                business.getApplicationSubmittedAt(),
                business.getCreatedAt(),
                LocalDateTime.now(clock));
    }

    public Priority classify(VerificationStatus status, LocalDateTime applicationSubmittedAt,
                             LocalDateTime createdAt, LocalDateTime now) {
        if (status == VerificationStatus.SUSPENDED) {
            return Priority.URGENT;
        }
        if (status != VerificationStatus.PENDING) {
            return Priority.NORMAL;
        }

        long ageDays = ageInDays(applicationSubmittedAt != null ? applicationSubmittedAt : createdAt, now);
        VerificationProperties.PriorityThresholds thresholds = properties.getPriority();
        if (ageDays > thresholds.getUrgentAfterDays()) {
            return Priority.URGENT;
        }
        if (ageDays > thresholds.getHighAfterDays()) {
            return Priority.HIGH;
        }
        return Priority.NORMAL;
    }

    static long ageInDays(LocalDateTime since, LocalDateTime now) {
        if (since == null) {
            return 0;
        }
        long millis = Duration.between(since, now).toMillis();
        if (millis <= 0) {
            return 0;
        }
        return (millis + MILLIS_PER_DAY - 1) / MILLIS_PER_DAY;
    }
}
