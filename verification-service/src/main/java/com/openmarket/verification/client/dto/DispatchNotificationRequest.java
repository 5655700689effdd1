package com.openmarket.verification.client.dto;

import java.util.Map;

public record DispatchNotificationRequest(
        String userId,
        String notificationType,
        Map<String, Object> templateVariables,
        Map<String, Object> metadata
) {
}
