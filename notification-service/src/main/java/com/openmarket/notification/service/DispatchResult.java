package com.openmarket.notification.service;

import com.openmarket.notification.domain.model.NotificationType;

import java.util.List;

public record DispatchResult(
        String userId,
        NotificationType notificationType,
        Status status,
        List<ChannelOutcome> channels
) {

    public enum Status {
        DISPATCHED,
        SUPPRESSED,
        /** No channel was enabled with a usable recipient. */
        NO_CHANNELS
    }

    public long sentCount() {
        return channels.stream().filter(c -> c.status() == ChannelOutcome.Status.SENT).count();
    }

    public long failedCount() {
        return channels.stream().filter(c -> c.status() == ChannelOutcome.Status.FAILED).count();
    }
}
