package com.openmarket.notification.domain.model;

import com.openmarket.common.exception.ValidationException;
import lombok.Getter;

/**
 * Event types the dispatcher knows about. The key doubles as the template key.
 */
@Getter
public enum NotificationType {
    CUSTOMER_WELCOME("customer_welcome"),
    CUSTOMER_BOOKING_ACCEPTED("customer_booking_accepted"),
    CUSTOMER_BOOKING_COMPLETED("customer_booking_completed"),
    CUSTOMER_BOOKING_REMINDER("customer_booking_reminder"),
    PROVIDER_NEW_BOOKING("provider_new_booking"),
    PROVIDER_BOOKING_CANCELLED("provider_booking_cancelled"),
    PROVIDER_BOOKING_RESCHEDULED("provider_booking_rescheduled"),
    ADMIN_BUSINESS_VERIFICATION("admin_business_verification"),
    BUSINESS_APPROVED("business_approved"),
    BUSINESS_REJECTED("business_rejected"),
    BUSINESS_DOCUMENT_REJECTED("business_document_rejected");

    private final String key;

    NotificationType(String key) {
        this.key = key;
    }

    /**
     * Accepts either the template key ({@code provider_new_booking}) or the constant name.
     */
    public static NotificationType fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Notification type is required");
        }
        for (NotificationType type : values()) {
            if (type.key.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("Unknown notification type: " + value);
    }
}
