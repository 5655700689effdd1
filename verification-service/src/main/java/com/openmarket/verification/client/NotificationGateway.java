package com.openmarket.verification.client;

import com.openmarket.common.dto.BaseResponse;
import com.openmarket.verification.client.dto.DispatchNotificationRequest;
import com.openmarket.verification.client.dto.DispatchResultResponse;
import com.openmarket.verification.orchestration.NotificationOutcome;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Best-effort bridge to notification-service.
 * Always answers with a {@link NotificationOutcome}; failures never reach the caller as exceptions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationGateway {

    private final NotificationClient notificationClient;

    @CircuitBreaker(name = "notification-service", fallbackMethod = "notificationUnavailable")
    public NotificationOutcome notify(String userId, String notificationType,
                                      Map<String, Object> templateVariables, Map<String, Object> metadata) {
        if (userId == null || userId.isBlank()) {
            log.info("No owner to notify for {}, skipping", notificationType);
            return NotificationOutcome.SKIPPED;
        }

        BaseResponse<DispatchResultResponse> response = notificationClient.dispatch(
                new DispatchNotificationRequest(userId, notificationType, templateVariables, metadata));
        DispatchResultResponse result = response != null ? response.getData() : null;
        if (result == null) {
            log.warn("Empty dispatch response for {} to user {}", notificationType, userId);
            return NotificationOutcome.FAILED;
        }

        NotificationOutcome outcome = toOutcome(result);
        log.info("Notification {} to user {}: {}", notificationType, userId, outcome);
        return outcome;
    }

    static NotificationOutcome toOutcome(DispatchResultResponse result) {
        if ("SUPPRESSED".equals(result.status())) {
            return NotificationOutcome.SUPPRESSED;
        }
        if ("NO_CHANNELS".equals(result.status())) {
            return NotificationOutcome.SKIPPED;
        }
        List<DispatchResultResponse.ChannelOutcomeResponse> channels =
                result.channels() != null ? result.channels() : List.of();
        long failed = channels.stream().filter(c -> "FAILED".equals(c.status())).count();
        // PENDING channels are still on their way; count them as handed over.
        long delivered = channels.stream()
                .filter(c -> "SENT".equals(c.status()) || "PENDING".equals(c.status()))
                .count();
        if (failed == 0) {
            return delivered > 0 ? NotificationOutcome.SENT : NotificationOutcome.SKIPPED;
        }
        return delivered > 0 ? NotificationOutcome.PARTIAL : NotificationOutcome.FAILED;
    }

    NotificationOutcome notificationUnavailable(String userId, String notificationType,
                                                Map<String, Object> templateVariables,
                                                Map<String, Object> metadata, Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.warn("Circuit open for notification-service, {} to user {} not sent", notificationType, userId);
            return NotificationOutcome.UNAVAILABLE;
        }
        if (ex instanceof FeignException fe && fe.status() >= 400 && fe.status() < 500) {
            // Unknown user, missing template: the service answered, the notification cannot go out.
            log.error("notification-service refused {} to user {}: HTTP {}", notificationType, userId, fe.status(), ex);
            return NotificationOutcome.FAILED;
        }
        log.error("notification-service unavailable, {} to user {} not sent", notificationType, userId, ex);
        return NotificationOutcome.UNAVAILABLE;
    }
}
