package com.openmarket.notification.client;

import com.openmarket.notification.client.dto.UserContactResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * Feign client for the identity/user directory.
 * A 404 from either endpoint means "no such record".
 */
@FeignClient(name = "user-service", url = "${clients.user-service.url}", path = "/api/v1/users")
public interface UserDirectoryClient {

    /** Contact data held by the identity service. */
    @GetMapping("/{userId}/contact")
    UserContactResponse getContact(@PathVariable("userId") String userId);

    /** Contact data from the linked customer or provider profile. */
    @GetMapping("/{userId}/profile-contact")
    UserContactResponse getProfileContact(@PathVariable("userId") String userId);
}
