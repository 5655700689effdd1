package com.openmarket.notification.service;

import com.openmarket.common.exception.ResourceNotFoundException;
import com.openmarket.common.exception.ServiceUnavailableException;
import com.openmarket.notification.client.UserDirectoryClient;
import com.openmarket.notification.client.dto.UserContactResponse;
import com.openmarket.notification.domain.model.UserNotificationPreference;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves notification email/phone for a user.
 * Priority per field: preference override, then linked profile, then identity record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactResolver {

    private final UserDirectoryClient userDirectoryClient;

    /**
     * @throws ResourceNotFoundException when the identity service does not know the user
     * @throws ServiceUnavailableException when the identity service cannot be reached
     */
    public ResolvedContact resolve(String userId, UserNotificationPreference preference) {
        UserContactResponse identity = lookupIdentity(userId);

        String email = preference != null ? clean(preference.getNotificationEmail()) : null;
        String phone = preference != null ? clean(preference.getNotificationPhone()) : null;

        if (email == null || phone == null) {
            UserContactResponse profile = lookupProfile(userId);
            if (profile != null) {
                email = email != null ? email : clean(profile.email());
                phone = phone != null ? phone : clean(profile.phone());
            }
        }

        email = email != null ? email : clean(identity.email());
        phone = phone != null ? phone : clean(identity.phone());

        log.debug("Notification contact for user {}: email={}, phone={}",
                userId, email != null ? "yes" : "no", phone != null ? "yes" : "no");
        return new ResolvedContact(email, phone);
    }

    private UserContactResponse lookupIdentity(String userId) {
        UserContactResponse identity;
        try {
            identity = userDirectoryClient.getContact(userId);
        } catch (FeignException.NotFound e) {
            throw new ResourceNotFoundException("User", userId);
        } catch (FeignException e) {
            throw new ServiceUnavailableException("Identity lookup failed for user " + userId, e);
        }
        if (identity == null) {
            throw new ResourceNotFoundException("User", userId);
        }
        return identity;
    }

    private UserContactResponse lookupProfile(String userId) {
        try {
            return userDirectoryClient.getProfileContact(userId);
        } catch (FeignException.NotFound e) {
            return null;
        } catch (FeignException e) {
            log.warn("Profile contact lookup failed for user {}, falling back to identity contact: {}",
                    userId, e.getMessage());
            return null;
        }
    }

    private static String clean(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
