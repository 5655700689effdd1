package com.openmarket.notification.api.controller;

import com.openmarket.common.dto.BaseResponse;
import com.openmarket.notification.api.dto.DispatchNotificationRequest;
import com.openmarket.notification.api.dto.NotificationLogResponse;
import com.openmarket.notification.domain.model.NotificationType;
import com.openmarket.notification.domain.repository.NotificationLogRepository;
import com.openmarket.notification.service.DispatchResult;
import com.openmarket.notification.service.NotificationDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST entry point for other services (verification decisions, bookings) to dispatch notifications.
 * A 200 means the dispatch ran; per-channel delivery is reported inside the result.
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationDispatcher notificationDispatcher;
    private final NotificationLogRepository notificationLogRepository;

    @PostMapping("/dispatch")
    public ResponseEntity<BaseResponse<DispatchResult>> dispatch(
            @Valid @RequestBody DispatchNotificationRequest request) {
        NotificationType type = NotificationType.fromKey(request.notificationType());
        DispatchResult result = notificationDispatcher.dispatch(
                request.userId(), type, request.templateVariables(), request.metadata());
        return ResponseEntity.ok(BaseResponse.success("Notification processed", result));
    }

    @GetMapping("/logs/user/{userId}")
    public ResponseEntity<BaseResponse<List<NotificationLogResponse>>> getLogsForUser(
            @PathVariable String userId) {
        List<NotificationLogResponse> logs = notificationLogRepository.findByUserIdOrderByCreatedAtDesc(userId)
                .stream()
                .map(NotificationLogResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(logs));
    }
}
