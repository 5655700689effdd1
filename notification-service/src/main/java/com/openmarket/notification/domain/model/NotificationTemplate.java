package com.openmarket.notification.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Notification template - MongoDB document.
 * Maintained by admins; the dispatcher only reads active templates.
 */
@Document(collection = "notification_templates")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationTemplate {
    @Id
    private String id;

    @Indexed
    @Field("template_key")
    private String templateKey;

    @Field("email_subject")
    private String emailSubject;

    @Field("email_body_html")
    private String emailBodyHtml;

    @Field("email_body_text")
    private String emailBodyText;

    /** Absent for types without an SMS variant. */
    @Field("sms_body")
    private String smsBody;

    @Field("is_active")
    private boolean active;
}
