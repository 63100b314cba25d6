package com.fleet.admin.common.exception;

public class ConfigValidationException extends FleetException {

    public ConfigValidationException(String message) {
        super(message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
