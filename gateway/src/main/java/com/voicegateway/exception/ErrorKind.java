package com.voicegateway.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

/**
 * Typed failure kinds surfaced verbatim to callers.
 */
public enum ErrorKind {

    INVALID_CREDENTIALS("invalid_credentials", HttpStatus.BAD_GATEWAY, false),
    QUOTA_EXCEEDED("quota_exceeded", HttpStatus.TOO_MANY_REQUESTS, false),
    UPSTREAM_TIMEOUT("upstream_timeout", HttpStatus.GATEWAY_TIMEOUT, true),
    UPSTREAM_REJECTED("upstream_rejected", HttpStatus.BAD_GATEWAY, false),
    MALFORMED_UPSTREAM_RESPONSE("malformed_upstream_response", HttpStatus.BAD_GATEWAY, false),
    NETWORK_UNAVAILABLE("network_unavailable", HttpStatus.SERVICE_UNAVAILABLE, true),
    CONFIG_VALIDATION_FAILED("config_validation_failed", HttpStatus.BAD_REQUEST, false),
    CONFIG_CONFLICT("config_conflict", HttpStatus.CONFLICT, false),
    REQUEST_VALIDATION_FAILED("request_validation_failed", HttpStatus.BAD_REQUEST, false);

    private final String code;
    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(String code, HttpStatus status, boolean retryable) {
        this.code = code;
        this.status = status;
        this.retryable = retryable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * Only transient transport failures are retried, and only once
     */
    public boolean isRetryable() {
        return retryable;
    }

    public boolean isUpstream() {
        return ordinal() <= NETWORK_UNAVAILABLE.ordinal();
    }
}
