package com.voicegateway.exception;

public class RequestValidationException extends GatewayException {

    public RequestValidationException(String reason) {
        super(ErrorKind.REQUEST_VALIDATION_FAILED, reason);
    }

    public String getReason() {
        return getMessage();
    }
}
