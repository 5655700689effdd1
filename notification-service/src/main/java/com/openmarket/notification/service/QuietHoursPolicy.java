package com.openmarket.notification.service;

import com.openmarket.notification.config.NotificationProperties;
import com.openmarket.notification.domain.model.UserNotificationPreference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Quiet-hours check at minute resolution. Both window ends are inclusive; a window whose start
 * is after its end (22:00-08:00) wraps past midnight.
 */
@Slf4j
@Component
public class QuietHoursPolicy {

    private final Clock clock;
    private final ZoneId defaultZone;

    public QuietHoursPolicy(Clock clock, NotificationProperties properties) {
        this.clock = clock;
        this.defaultZone = ZoneId.of(properties.getDefaultTimezone());
    }

    public boolean isQuietTime(UserNotificationPreference preference) {
        if (preference == null || !preference.isQuietHoursEnabled()) {
            return false;
        }
        LocalTime start = parse(preference.getQuietHoursStart(), preference.getUserId());
        LocalTime end = parse(preference.getQuietHoursEnd(), preference.getUserId());
        if (start == null || end == null) {
            return false;
        }
        LocalTime now = LocalTime.now(clock.withZone(zoneOf(preference))).truncatedTo(ChronoUnit.MINUTES);
        return isWithin(now, start, end);
    }

    static boolean isWithin(LocalTime now, LocalTime start, LocalTime end) {
        if (start.isAfter(end)) {
            return !now.isBefore(start) || !now.isAfter(end);
        }
        return !now.isBefore(start) && !now.isAfter(end);
    }

    private ZoneId zoneOf(UserNotificationPreference preference) {
        String timezone = preference.getTimezone();
        if (timezone == null || timezone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("Invalid timezone '{}' for user {}, using {}", timezone, preference.getUserId(), defaultZone);
            return defaultZone;
        }
    }

    private LocalTime parse(String value, String userId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable quiet-hours bound '{}' for user {}", value, userId);
            return null;
        }
    }
}
