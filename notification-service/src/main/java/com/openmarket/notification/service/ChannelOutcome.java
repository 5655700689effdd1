package com.openmarket.notification.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openmarket.notification.domain.model.Channel;
import com.openmarket.notification.transport.TransportResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelOutcome(
        Channel channel,
        Status status,
        String externalId,
        String detail
) {

    public enum Status {
        SENT,
        FAILED,
        /** Nothing to send on this channel (e.g. template without SMS body). */
        SKIPPED,
        SUPPRESSED,
        /** Still running when the bounded wait elapsed; its log row is written on completion. */
        PENDING
    }

    public static ChannelOutcome of(Channel channel, TransportResult result) {
        return result.isSent()
                ? new ChannelOutcome(channel, Status.SENT, result.externalId(), null)
                : new ChannelOutcome(channel, Status.FAILED, null, result.errorMessage());
    }

    public static ChannelOutcome failed(Channel channel, String detail) {
        return new ChannelOutcome(channel, Status.FAILED, null, detail);
    }

    public static ChannelOutcome skipped(Channel channel, String detail) {
        return new ChannelOutcome(channel, Status.SKIPPED, null, detail);
    }

    public static ChannelOutcome suppressed(Channel channel) {
        return new ChannelOutcome(channel, Status.SUPPRESSED, null, "quiet hours");
    }

    public static ChannelOutcome pending(Channel channel) {
        return new ChannelOutcome(channel, Status.PENDING, null, "still sending");
    }
}
