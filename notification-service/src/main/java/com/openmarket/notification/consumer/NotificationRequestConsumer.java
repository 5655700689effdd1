package com.openmarket.notification.consumer;

import com.openmarket.common.exception.BusinessException;
import com.openmarket.common.util.Topics;
import com.openmarket.notification.domain.model.NotificationType;
import com.openmarket.notification.service.DispatchResult;
import com.openmarket.notification.service.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for dispatch requests from other services (e.g. booking lifecycle events).
 * Best-effort like every dispatch: failures are logged and the record is not redelivered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationRequestConsumer {

    private final NotificationDispatcher notificationDispatcher;

    @KafkaListener(topics = Topics.NOTIFICATION_REQUESTS, groupId = "notification-service-group")
    public void handleNotificationRequested(NotificationRequestedEvent event) {
        log.info("Received notification request: type={}, user={}", event.getNotificationType(), event.getUserId());

        try {
            NotificationType type = NotificationType.fromKey(event.getNotificationType());
            DispatchResult result = notificationDispatcher.dispatch(
                    event.getUserId(), type, event.getTemplateVariables(), event.getMetadata());
            log.info("Processed notification request for user {}: {}", event.getUserId(), result.status());
        } catch (BusinessException e) {
            log.warn("Dropping notification request for user {}: {}", event.getUserId(), e.getMessage());
        } catch (Exception e) {
            log.error("Error processing notification request for user {}", event.getUserId(), e);
        }
    }
}
