package com.voicegateway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.voicegateway.exception.ErrorKind;
import com.voicegateway.exception.UpstreamException;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Maps vendor and transport failures onto the six upstream error kinds.
 */
public final class UpstreamErrors {

    private UpstreamErrors() {
    }

    public static UpstreamException translate(String providerName, Throwable error) {
        if (error instanceof UpstreamException) {
            return (UpstreamException) error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            int status = response.getStatusCode().value();
            return new UpstreamException(fromStatus(status), providerName,
                    "HTTP " + status + ": " + response.getResponseBodyAsString(), error);
        }
        if (error instanceof BulkheadFullException) {
            return new UpstreamException(ErrorKind.QUOTA_EXCEEDED, providerName,
                    "local concurrency limit reached", error);
        }
        if (error instanceof CodecException || error instanceof JsonProcessingException) {
            return new UpstreamException(ErrorKind.MALFORMED_UPSTREAM_RESPONSE, providerName,
                    error.getMessage(), error);
        }
        if (isTimeout(error)) {
            return new UpstreamException(ErrorKind.UPSTREAM_TIMEOUT, providerName, describe(error), error);
        }
        if (error instanceof WebClientRequestException || hasCause(error, ConnectException.class)
                || hasCause(error, UnknownHostException.class)) {
            return new UpstreamException(ErrorKind.NETWORK_UNAVAILABLE, providerName, describe(error), error);
        }
        return new UpstreamException(ErrorKind.UPSTREAM_REJECTED, providerName, describe(error), error);
    }

    public static ErrorKind fromStatus(int status) {
        return switch (status) {
            case 401, 403 -> ErrorKind.INVALID_CREDENTIALS;
            case 402, 429 -> ErrorKind.QUOTA_EXCEEDED;
            case 408, 504 -> ErrorKind.UPSTREAM_TIMEOUT;
            default -> ErrorKind.UPSTREAM_REJECTED;
        };
    }

    public static UpstreamException malformed(String providerName, String detail) {
        return new UpstreamException(ErrorKind.MALFORMED_UPSTREAM_RESPONSE, providerName, detail);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            // netty's ReadTimeoutException does not extend java.util.concurrent.TimeoutException
            if (t instanceof TimeoutException || t.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }
}
