package com.openmarket.notification.service;

import com.openmarket.notification.domain.model.NotificationType;

import java.util.Map;

record DispatchContext(
        String userId,
        NotificationType type,
        Map<String, ?> variables,
        Map<String, Object> metadata
) {
}
