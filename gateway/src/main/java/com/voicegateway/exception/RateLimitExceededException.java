package com.voicegateway.exception;

/**
 * Inbound request refused by the per-client token bucket. Not part of the provider error
 * taxonomy: no adapter was called.
 */
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String identifier, long retryAfterSeconds) {
        super("Rate limit exceeded for client " + identifier + ". Please try again later.");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
