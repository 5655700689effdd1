package com.openmarket.common.exception;

/**
 * Input is missing a required field (notes, reason, approver). The caller must fix the request.
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
