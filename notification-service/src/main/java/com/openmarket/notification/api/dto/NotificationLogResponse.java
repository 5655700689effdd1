package com.openmarket.notification.api.dto;

import com.openmarket.notification.domain.model.Channel;
import com.openmarket.notification.domain.model.NotificationLog;

import java.time.LocalDateTime;

public record NotificationLogResponse(
        String id,
        Channel channel,
        String recipient,
        String notificationType,
        NotificationLog.DeliveryStatus status,
        String externalId,
        String subject,
        String errorMessage,
        LocalDateTime sentAt,
        LocalDateTime createdAt
) {
    public static NotificationLogResponse from(NotificationLog log) {
        return new NotificationLogResponse(
                log.getId(),
                log.getChannel(),
                log.getRecipient(),
                log.getNotificationType(),
                log.getStatus(),
                log.getExternalId(),
                log.getSubject(),
                log.getErrorMessage(),
                log.getSentAt(),
                log.getCreatedAt()
        );
    }
}
