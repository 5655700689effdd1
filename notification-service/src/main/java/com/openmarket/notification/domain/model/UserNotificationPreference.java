package com.openmarket.notification.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.Map;

/**
 * Per-user notification settings - MongoDB document owned by the user-settings screens.
 * Read-only here. Null toggles mean "not chosen yet" and fall back to the channel defaults.
 */
@Document(collection = "user_settings")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserNotificationPreference {
    @Id
    private String id;

    @Indexed(unique = true)
    @Field("user_id")
    private String userId;

    @Field("email_notifications")
    private Boolean emailEnabled;

    @Field("sms_notifications")
    private Boolean smsEnabled;

    /** Per-type switches keyed by column name, e.g. {@code provider_new_booking_sms}. */
    @Field("channel_overrides")
    private Map<String, Boolean> channelOverrides;

    @Field("quiet_hours_enabled")
    private boolean quietHoursEnabled;

    /** Local time of day, {@code HH:mm} or {@code HH:mm:ss}. */
    @Field("quiet_hours_start")
    private String quietHoursStart;

    @Field("quiet_hours_end")
    private String quietHoursEnd;

    /** IANA zone id for quiet hours; service default when absent. */
    @Field("timezone")
    private String timezone;

    @Field("notification_email")
    private String notificationEmail;

    @Field("notification_phone")
    private String notificationPhone;

    public boolean channelOverride(String column, boolean defaultValue) {
        if (column == null || channelOverrides == null) {
            return defaultValue;
        }
        Boolean value = channelOverrides.get(column);
        return value != null ? value : defaultValue;
    }
}
