package com.openmarket.notification.service;

import com.openmarket.notification.domain.model.NotificationType;
import com.openmarket.notification.domain.model.UserNotificationPreference;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decides which channels fire for a notification type and user.
 * <p>
 * email = master email toggle (default on) AND per-type email switch (default on);
 * sms = master SMS toggle (default off) AND per-type SMS switch (default off).
 */
@Component
public class ChannelResolver {

    private static final Map<NotificationType, PreferenceColumns> PREFERENCE_COLUMNS;

    static {
        Map<NotificationType, PreferenceColumns> columns = new EnumMap<>(NotificationType.class);
        // Welcome mails have no SMS variant.
        columns.put(NotificationType.CUSTOMER_WELCOME, new PreferenceColumns("customer_welcome_email", null));
        columns.put(NotificationType.CUSTOMER_BOOKING_ACCEPTED, PreferenceColumns.of("customer_booking_accepted"));
        columns.put(NotificationType.CUSTOMER_BOOKING_COMPLETED, PreferenceColumns.of("customer_booking_completed"));
        columns.put(NotificationType.CUSTOMER_BOOKING_REMINDER, PreferenceColumns.of("customer_booking_reminder"));
        columns.put(NotificationType.PROVIDER_NEW_BOOKING, PreferenceColumns.of("provider_new_booking"));
        columns.put(NotificationType.PROVIDER_BOOKING_CANCELLED, PreferenceColumns.of("provider_booking_cancelled"));
        columns.put(NotificationType.PROVIDER_BOOKING_RESCHEDULED, PreferenceColumns.of("provider_booking_rescheduled"));
        PreferenceColumns verification = PreferenceColumns.of("admin_business_verification");
        columns.put(NotificationType.ADMIN_BUSINESS_VERIFICATION, verification);
        columns.put(NotificationType.BUSINESS_APPROVED, verification);
        columns.put(NotificationType.BUSINESS_REJECTED, verification);
        columns.put(NotificationType.BUSINESS_DOCUMENT_REJECTED, verification);
        PREFERENCE_COLUMNS = Collections.unmodifiableMap(columns);
    }

    public ChannelSelection resolve(NotificationType type, UserNotificationPreference preference) {
        if (preference == null) {
            return ChannelSelection.DEFAULT;
        }
        PreferenceColumns columns = PREFERENCE_COLUMNS.get(type);
        boolean emailMaster = !Boolean.FALSE.equals(preference.getEmailEnabled());
        boolean smsMaster = Boolean.TRUE.equals(preference.getSmsEnabled());

        boolean email = emailMaster && preference.channelOverride(columns.email(), true);
        boolean sms = smsMaster && columns.sms() != null && preference.channelOverride(columns.sms(), false);
        return new ChannelSelection(email, sms);
    }

    static PreferenceColumns columnsFor(NotificationType type) {
        return PREFERENCE_COLUMNS.get(type);
    }

    record PreferenceColumns(String email, String sms) {
        static PreferenceColumns of(String prefix) {
            return new PreferenceColumns(prefix + "_email", prefix + "_sms");
        }
    }
}
