package com.openmarket.verification.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Dispatch result as returned by notification-service.
 * Status values: DISPATCHED, SUPPRESSED, NO_CHANNELS; channel status: SENT, FAILED, SKIPPED, SUPPRESSED, PENDING.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchResultResponse(
        String userId,
        String notificationType,
        String status,
        List<ChannelOutcomeResponse> channels
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChannelOutcomeResponse(
            String channel,
            String status,
            String externalId,
            String detail
    ) {
    }
}
