package com.openmarket.common.exception;

/**
 * Required configuration data (e.g. an active notification template) is missing.
 * Aborts the operation and is surfaced to the caller.
 */
public class ConfigurationException extends BusinessException {
    public ConfigurationException(String message) {
        super(message, "CONFIGURATION_ERROR");
    }
}
