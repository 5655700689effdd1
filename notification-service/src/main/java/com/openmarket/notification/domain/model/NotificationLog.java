package com.openmarket.notification.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Delivery audit row - MongoDB document.
 * One row per dispatch attempt per channel. Rows are inserted and never updated.
 */
@Document(collection = "notification_logs")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLog {
    @Id
    private String id;

    @Indexed
    @Field("user_id")
    private String userId;

    private Channel channel;

    private String recipient;

    @Field("notification_type")
    private String notificationType;

    private DeliveryStatus status;

    /** Id assigned by the transport (Resend message id, Twilio SID). */
    @Field("external_id")
    private String externalId;

    private String subject;

    private String body;

    @Field("error_message")
    private String errorMessage;

    @Field("sent_at")
    private LocalDateTime sentAt;

    @Field("created_at")
    private LocalDateTime createdAt;

    private Map<String, Object> metadata;

    public enum DeliveryStatus {
        PENDING,
        SENT,
        DELIVERED,
        FAILED,
        SUPPRESSED
    }
}
