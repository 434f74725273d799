package com.voicegateway.exception;

/**
 * A configuration update was rejected. Nothing was changed.
 */
public class ConfigValidationException extends GatewayException {

    private final String field;

    public ConfigValidationException(String field, String reason) {
        super(ErrorKind.CONFIG_VALIDATION_FAILED, field + ": " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
