package com.openmarket.verification.config;

import com.openmarket.verification.client.NotificationClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Kept off the application class so JPA slice tests start without Feign.
 */
@Configuration
@EnableFeignClients(basePackageClasses = NotificationClient.class)
public class FeignConfig {
}
