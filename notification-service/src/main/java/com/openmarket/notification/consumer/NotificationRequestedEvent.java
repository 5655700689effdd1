package com.openmarket.notification.consumer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Dispatch request published by other marketplace services.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequestedEvent {
    private String userId;
    /** Template key, e.g. {@code provider_new_booking}. */
    private String notificationType;
    private Map<String, Object> templateVariables;
    private Map<String, Object> metadata;
    private Instant timestamp;
}
