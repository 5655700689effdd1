package com.openmarket.notification.service;

/**
 * Where a notification goes. A null address disables that channel for the call.
 */
public record ResolvedContact(String email, String phone) {
}
