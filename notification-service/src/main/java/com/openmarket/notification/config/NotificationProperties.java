package com.openmarket.notification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "notification")
public class NotificationProperties {

    /** Zone used for quiet hours when the user has not set one. */
    private String defaultTimezone = "UTC";

    private QuietHours quietHours = new QuietHours();

    private Dispatch dispatch = new Dispatch();

    @Data
    public static class QuietHours {
        /** Write a SUPPRESSED log row for each channel skipped because of quiet hours. */
        private boolean auditSuppressed = true;
    }

    @Data
    public static class Dispatch {
        /** Upper bound on waiting for channel attempts; zero waits for all of them. */
        private Duration awaitTimeout = Duration.ZERO;
    }
}
