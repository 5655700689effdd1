package com.openmarket.common.exception;

import lombok.Getter;

/**
 * Requested status change is not in the allowed transition table.
 */
@Getter
public class InvalidTransitionException extends BusinessException {
    private final String fromStatus;
    private final String action;

    public InvalidTransitionException(String resourceType, Object identifier, String fromStatus, String action) {
        super(String.format("Cannot %s %s %s while it is %s", action, resourceType, identifier, fromStatus),
                "INVALID_TRANSITION");
        this.fromStatus = fromStatus;
        this.action = action;
    }
}
