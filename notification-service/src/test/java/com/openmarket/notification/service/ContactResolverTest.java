package com.openmarket.notification.service;

import com.openmarket.common.exception.ResourceNotFoundException;
import com.openmarket.common.exception.ServiceUnavailableException;
import com.openmarket.notification.client.UserDirectoryClient;
import com.openmarket.notification.client.dto.UserContactResponse;
import com.openmarket.notification.domain.model.UserNotificationPreference;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContactResolverTest {

    private static final Request REQUEST = Request.create(
            Request.HttpMethod.GET, "http://user-service/api/v1/users/u-1/contact",
            Map.of(), null, StandardCharsets.UTF_8, null);

    @Mock
    private UserDirectoryClient userDirectoryClient;

    @InjectMocks
    private ContactResolver contactResolver;

    @Test
    @DisplayName("preference overrides win, profile is not consulted when both are set")
    void resolve_preferenceOverridesWin() {
        when(userDirectoryClient.getContact("u-1"))
                .thenReturn(new UserContactResponse("u-1", "auth@example.com", "+15550000001"));
        UserNotificationPreference preference = UserNotificationPreference.builder()
                .userId("u-1")
                .notificationEmail("  alerts@example.com ")
                .notificationPhone("+15550000002")
                .build();

        ResolvedContact contact = contactResolver.resolve("u-1", preference);

        assertThat(contact).isEqualTo(new ResolvedContact("alerts@example.com", "+15550000002"));
        verify(userDirectoryClient, never()).getProfileContact(any());
    }

    @Test
    @DisplayName("profile contact fills gaps before falling back to the identity record")
    void resolve_profileThenIdentity() {
        when(userDirectoryClient.getContact("u-1"))
                .thenReturn(new UserContactResponse("u-1", "auth@example.com", "+15550000001"));
        when(userDirectoryClient.getProfileContact("u-1"))
                .thenReturn(new UserContactResponse("u-1", "provider@example.com", " "));

        ResolvedContact contact = contactResolver.resolve("u-1", null);

        assertThat(contact.email()).isEqualTo("provider@example.com");
        assertThat(contact.phone()).isEqualTo("+15550000001");
    }

    @Test
    @DisplayName("missing profile and phone leave the SMS recipient null")
    void resolve_noPhoneAnywhere() {
        when(userDirectoryClient.getContact("u-1"))
                .thenReturn(new UserContactResponse("u-1", "auth@example.com", null));
        when(userDirectoryClient.getProfileContact("u-1"))
                .thenThrow(new FeignException.NotFound("not found", REQUEST, null, Map.of()));

        ResolvedContact contact = contactResolver.resolve("u-1", null);

        assertThat(contact).isEqualTo(new ResolvedContact("auth@example.com", null));
    }

    @Test
    @DisplayName("unknown user aborts with ResourceNotFoundException")
    void resolve_unknownUser() {
        when(userDirectoryClient.getContact("ghost"))
                .thenThrow(new FeignException.NotFound("not found", REQUEST, null, Map.of()));

        assertThatThrownBy(() -> contactResolver.resolve("ghost", null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("identity service outage aborts with ServiceUnavailableException")
    void resolve_identityDown() {
        when(userDirectoryClient.getContact("u-1"))
                .thenThrow(new FeignException.ServiceUnavailable("down", REQUEST, null, Map.of()));

        assertThatThrownBy(() -> contactResolver.resolve("u-1", null))
                .isInstanceOf(ServiceUnavailableException.class);
    }
}
