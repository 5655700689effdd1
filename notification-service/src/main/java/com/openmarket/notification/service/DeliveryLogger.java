package com.openmarket.notification.service;

import com.openmarket.notification.domain.model.Channel;
import com.openmarket.notification.domain.model.NotificationLog;
import com.openmarket.notification.domain.repository.NotificationLogRepository;
import com.openmarket.notification.transport.TransportResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes the delivery audit trail. A failing log store is reported but never fails a dispatch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryLogger {

    private final NotificationLogRepository notificationLogRepository;
    private final Clock clock;

    public void recordAttempt(DispatchContext context, Channel channel, String recipient,
                              String subject, String body, TransportResult result) {
        LocalDateTime now = LocalDateTime.now(clock);
        NotificationLog.NotificationLogBuilder entry = baseEntry(context, channel, recipient, now)
                .subject(subject)
                .body(body);
        if (result.isSent()) {
            entry.status(NotificationLog.DeliveryStatus.SENT)
                    .externalId(result.externalId())
                    .sentAt(now);
        } else {
            entry.status(NotificationLog.DeliveryStatus.FAILED)
                    .errorMessage(result.errorMessage());
        }
        insert(entry.build());
    }

    public void recordSuppressed(DispatchContext context, Channel channel, String recipient) {
        insert(baseEntry(context, channel, recipient, LocalDateTime.now(clock))
                .status(NotificationLog.DeliveryStatus.SUPPRESSED)
                .errorMessage("Suppressed by quiet hours")
                .build());
    }

    private NotificationLog.NotificationLogBuilder baseEntry(DispatchContext context, Channel channel,
                                                             String recipient, LocalDateTime now) {
        return NotificationLog.builder()
                .userId(context.userId())
                .channel(channel)
                .recipient(recipient)
                .notificationType(context.type().getKey())
                .metadata(context.metadata())
                .createdAt(now);
    }

    private void insert(NotificationLog entry) {
        try {
            notificationLogRepository.insert(entry);
        } catch (RuntimeException e) {
            // Store outages and mapping rejections alike: the attempt already happened.
            log.error("Failed to write {} log row for user {} ({})",
                    entry.getChannel(), entry.getUserId(), entry.getStatus(), e);
        }
    }
}
