package com.openmarket.notification.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record DispatchNotificationRequest(
        @NotBlank(message = "User ID cannot be blank")
        String userId,

        @NotBlank(message = "Notification type cannot be blank")
        String notificationType,

        Map<String, Object> templateVariables,

        Map<String, Object> metadata
) {
}
