package com.openmarket.notification.service;

import com.openmarket.notification.config.NotificationProperties;
import com.openmarket.notification.domain.model.UserNotificationPreference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class QuietHoursPolicyTest {

    private static final UserNotificationPreference OVERNIGHT = UserNotificationPreference.builder()
            .userId("u-1")
            .quietHoursEnabled(true)
            .quietHoursStart("22:00")
            .quietHoursEnd("08:00")
            .build();

    private static QuietHoursPolicy policyAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new QuietHoursPolicy(clock, new NotificationProperties());
    }

    @Test
    @DisplayName("overnight window 22:00-08:00 suppresses at 23:00 and 05:00 but not at 12:00")
    void overnightWindow() {
        assertThat(policyAt("2026-03-10T23:00:00Z").isQuietTime(OVERNIGHT)).isTrue();
        assertThat(policyAt("2026-03-10T05:00:00Z").isQuietTime(OVERNIGHT)).isTrue();
        assertThat(policyAt("2026-03-10T12:00:00Z").isQuietTime(OVERNIGHT)).isFalse();
    }

    @Test
    @DisplayName("window bounds are inclusive at minute resolution")
    void boundsInclusive() {
        assertThat(policyAt("2026-03-10T08:00:59Z").isQuietTime(OVERNIGHT)).isTrue();
        assertThat(policyAt("2026-03-10T08:01:00Z").isQuietTime(OVERNIGHT)).isFalse();
        assertThat(policyAt("2026-03-10T22:00:00Z").isQuietTime(OVERNIGHT)).isTrue();
        assertThat(policyAt("2026-03-10T21:59:00Z").isQuietTime(OVERNIGHT)).isFalse();
    }

    @Test
    @DisplayName("same-day window with seconds in the stored bounds")
    void sameDayWindow() {
        UserNotificationPreference preference = UserNotificationPreference.builder()
                .quietHoursEnabled(true)
                .quietHoursStart("13:00:00")
                .quietHoursEnd("15:30:00")
                .build();

        assertThat(policyAt("2026-03-10T14:00:00Z").isQuietTime(preference)).isTrue();
        assertThat(policyAt("2026-03-10T16:00:00Z").isQuietTime(preference)).isFalse();
    }

    @Test
    @DisplayName("disabled flag, missing bounds or missing preference never suppress")
    void notConfigured() {
        UserNotificationPreference disabled = UserNotificationPreference.builder()
                .quietHoursEnabled(false)
                .quietHoursStart("00:00")
                .quietHoursEnd("23:59")
                .build();
        UserNotificationPreference missingEnd = UserNotificationPreference.builder()
                .quietHoursEnabled(true)
                .quietHoursStart("00:00")
                .build();
        QuietHoursPolicy policy = policyAt("2026-03-10T12:00:00Z");

        assertThat(policy.isQuietTime(disabled)).isFalse();
        assertThat(policy.isQuietTime(missingEnd)).isFalse();
        assertThat(policy.isQuietTime(null)).isFalse();
    }

    @Test
    @DisplayName("user timezone shifts the local time that is compared")
    void userTimezone() {
        UserNotificationPreference tokyo = UserNotificationPreference.builder()
                .quietHoursEnabled(true)
                .quietHoursStart("22:00")
                .quietHoursEnd("08:00")
                .timezone("Asia/Tokyo")
                .build();

        // 14:00 UTC is 23:00 in Tokyo
        assertThat(policyAt("2026-03-10T14:00:00Z").isQuietTime(tokyo)).isTrue();
        // 03:00 UTC is 12:00 in Tokyo
        assertThat(policyAt("2026-03-10T03:00:00Z").isQuietTime(tokyo)).isFalse();
    }

    @Test
    @DisplayName("unparseable bounds are ignored")
    void invalidBounds() {
        UserNotificationPreference preference = UserNotificationPreference.builder()
                .quietHoursEnabled(true)
                .quietHoursStart("late")
                .quietHoursEnd("08:00")
                .build();

        assertThat(policyAt("2026-03-10T23:00:00Z").isQuietTime(preference)).isFalse();
    }
}
