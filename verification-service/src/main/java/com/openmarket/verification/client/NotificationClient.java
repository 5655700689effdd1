package com.openmarket.verification.client;

import com.openmarket.common.dto.BaseResponse;
import com.openmarket.verification.client.dto.DispatchNotificationRequest;
import com.openmarket.verification.client.dto.DispatchResultResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for notification-service. Called once per decision, never retried.
 */
@FeignClient(name = "notification-service", url = "${clients.notification-service.url}", path = "/api/v1/notifications")
public interface NotificationClient {

    @PostMapping("/dispatch")
    BaseResponse<DispatchResultResponse> dispatch(@RequestBody DispatchNotificationRequest request);
}
