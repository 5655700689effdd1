package com.openmarket.verification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Admin verification workflow for marketplace businesses and their documents.
 * Decisions are persisted here; the owner is notified through notification-service.
 */
@SpringBootApplication(scanBasePackages = {"com.openmarket.verification", "com.openmarket.common"})
public class VerificationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerificationServiceApplication.class, args);
    }
}
