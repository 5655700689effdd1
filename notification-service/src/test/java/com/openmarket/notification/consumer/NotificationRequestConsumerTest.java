package com.openmarket.notification.consumer;

import com.openmarket.common.exception.ResourceNotFoundException;
import com.openmarket.notification.domain.model.NotificationType;
import com.openmarket.notification.service.DispatchResult;
import com.openmarket.notification.service.NotificationDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationRequestConsumerTest {

    @Mock
    private NotificationDispatcher notificationDispatcher;

    @InjectMocks
    private NotificationRequestConsumer consumer;

    private static NotificationRequestedEvent event(String type) {
        NotificationRequestedEvent event = new NotificationRequestedEvent();
        event.setUserId("u-7");
        event.setNotificationType(type);
        event.setTemplateVariables(Map.of("customer_name", "Ana"));
        return event;
    }

    @Test
    @DisplayName("valid request is dispatched with its variables")
    void handle_dispatches() {
        when(notificationDispatcher.dispatch("u-7", NotificationType.CUSTOMER_BOOKING_ACCEPTED,
                Map.of("customer_name", "Ana"), null))
                .thenReturn(new DispatchResult("u-7", NotificationType.CUSTOMER_BOOKING_ACCEPTED,
                        DispatchResult.Status.DISPATCHED, List.of()));

        consumer.handleNotificationRequested(event("customer_booking_accepted"));

        verify(notificationDispatcher).dispatch("u-7", NotificationType.CUSTOMER_BOOKING_ACCEPTED,
                Map.of("customer_name", "Ana"), null);
    }

    @Test
    @DisplayName("unknown type is dropped without calling the dispatcher")
    void handle_unknownType() {
        assertThatCode(() -> consumer.handleNotificationRequested(event("nope"))).doesNotThrowAnyException();

        verifyNoInteractions(notificationDispatcher);
    }

    @Test
    @DisplayName("dispatch failure is logged, not rethrown")
    void handle_dispatchFails() {
        when(notificationDispatcher.dispatch(any(), any(), any(), any()))
                .thenThrow(new ResourceNotFoundException("User", "u-7"));

        assertThatCode(() -> consumer.handleNotificationRequested(event("customer_welcome")))
                .doesNotThrowAnyException();
    }
}
