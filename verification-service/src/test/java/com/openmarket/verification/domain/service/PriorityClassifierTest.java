package com.openmarket.verification.domain.service;

import com.openmarket.verification.config.VerificationProperties;
import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.Priority;
import com.openmarket.verification.domain.model.VerificationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityClassifierTest {

    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    private final PriorityClassifier classifier =
            new PriorityClassifier(Clock.fixed(NOW, ZoneOffset.UTC), new VerificationProperties());

    private static Business pending(LocalDateTime submittedAt, LocalDateTime createdAt) {
        return Business.builder()
                .displayName("Glow Spa")
                .verificationStatus(VerificationStatus.PENDING)
                .applicationSubmittedAt(submittedAt)
                .createdAt(createdAt)
                .build();
    }

    @ParameterizedTest(name = "pending for {0} minutes -> {1}")
    @CsvSource({
            "1440,   NORMAL",   // 1 day
            "4320,   NORMAL",   // exactly 3 days
            "4321,   HIGH",     // 3 days and 1 minute counts as 4
            "5760,   HIGH",     // 4 days
            "10080,  HIGH",     // exactly 7 days
            "10081,  URGENT",
            "11520,  URGENT"    // 8 days
    })
    @DisplayName("pending businesses escalate with application age in started days")
    void classify_pendingByAge(long minutesOld, Priority expected) {
        Business business = pending(NOW_LOCAL.minusMinutes(minutesOld), NOW_LOCAL.minusDays(30));

        assertThat(classifier.classify(business)).isEqualTo(expected);
    }

    @Test
    @DisplayName("suspended is urgent regardless of age")
    void classify_suspended() {
        Business business = pending(NOW_LOCAL.minusHours(1), NOW_LOCAL.minusHours(1));
        business.setVerificationStatus(VerificationStatus.SUSPENDED);

        assertThat(classifier.classify(business)).isEqualTo(Priority.URGENT);
    }

    @Test
    @DisplayName("approved and rejected are normal regardless of age")
    void classify_decidedIsNormal() {
        LocalDateTime longAgo = NOW_LOCAL.minusDays(60);

        assertThat(classifier.classify(VerificationStatus.APPROVED, longAgo, longAgo, NOW_LOCAL))
                .isEqualTo(Priority.NORMAL);
        assertThat(classifier.classify(VerificationStatus.REJECTED, longAgo, longAgo, NOW_LOCAL))
                .isEqualTo(Priority.NORMAL);
    }

    @Test
    @DisplayName("age falls back to createdAt when the application timestamp is missing")
    void classify_fallsBackToCreatedAt() {
        assertThat(classifier.classify(pending(null, NOW_LOCAL.minusDays(8)))).isEqualTo(Priority.URGENT);
        assertThat(classifier.classify(pending(null, null))).isEqualTo(Priority.NORMAL);
    }

    @Test
    @DisplayName("application timestamp wins over createdAt")
    void classify_prefersSubmittedAt() {
        Business business = pending(NOW_LOCAL.minusDays(1), NOW_LOCAL.minusDays(20));

        assertThat(classifier.classify(business)).isEqualTo(Priority.NORMAL);
    }

    @Test
    @DisplayName("thresholds come from configuration")
    void classify_customThresholds() {
        VerificationProperties properties = new VerificationProperties();
        properties.getPriority().setHighAfterDays(1);
        properties.getPriority().setUrgentAfterDays(2);
        PriorityClassifier strict = new PriorityClassifier(Clock.fixed(NOW, ZoneOffset.UTC), properties);

        assertThat(strict.classify(pending(NOW_LOCAL.minusDays(2), null))).isEqualTo(Priority.HIGH);
        assertThat(strict.classify(pending(NOW_LOCAL.minusDays(3), null))).isEqualTo(Priority.URGENT);
    }

    @Test
    @DisplayName("future timestamps count as zero days")
    void ageInDays_future() {
        assertThat(PriorityClassifier.ageInDays(NOW_LOCAL.plusDays(2), NOW_LOCAL)).isZero();
    }
}
