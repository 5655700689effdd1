package com.openmarket.verification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "verification")
public class VerificationProperties {

    private PriorityThresholds priority = new PriorityThresholds();

    private DecisionNotifications notifications = new DecisionNotifications();

    @Data
    public static class PriorityThresholds {
        /** Pending applications older than this many days are high priority. */
        private int highAfterDays = 3;
        /** Pending applications older than this many days are urgent. */
        private int urgentAfterDays = 7;
    }

    @Data
    public static class DecisionNotifications {
        /** Notify the business owner about approvals and rejections. */
        private boolean enabled = true;
    }
}
