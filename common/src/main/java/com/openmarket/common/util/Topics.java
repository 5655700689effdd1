package com.openmarket.common.util;

/**
 * Kafka topic names shared between services.
 */
public final class Topics {
    private Topics() {
        // Utility class
    }

    /** Dispatch requests from other marketplace services (bookings, onboarding). */
    public static final String NOTIFICATION_REQUESTS = "notification-requests";

    public static final String BUSINESS_VERIFICATION_DECIDED = "business-verification-decided";
}
