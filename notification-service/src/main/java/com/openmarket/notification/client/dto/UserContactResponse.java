package com.openmarket.notification.client.dto;

public record UserContactResponse(
        String userId,
        String email,
        String phone
) {
}
