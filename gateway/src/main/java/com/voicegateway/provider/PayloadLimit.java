package com.voicegateway.provider;

import com.voicegateway.model.AdapterDescriptor;

import java.nio.charset.StandardCharsets;

/**
 * Maximum input accepted by an adapter. Oversized input is rejected unless the adapter's
 * descriptor opts into truncation with {@code oversize_policy=truncate}; audio is never truncated.
 */
public record PayloadLimit(long max, Unit unit, boolean truncate) {

    public static final String OVERSIZE_POLICY = "oversize_policy";

    public enum Unit { BYTES, CHARACTERS }

    public static PayloadLimit bytes(long max) {
        return new PayloadLimit(max, Unit.BYTES, false);
    }

    public static PayloadLimit characters(long max) {
        return new PayloadLimit(max, Unit.CHARACTERS, false);
    }

    public static PayloadLimit unlimited() {
        return new PayloadLimit(Long.MAX_VALUE, Unit.BYTES, false);
    }

    /**
     * Applies the descriptor's oversize policy to a character limit
     */
    public PayloadLimit withPolicyFrom(AdapterDescriptor descriptor) {
        boolean truncateRequested = "truncate".equalsIgnoreCase(descriptor.parameter(OVERSIZE_POLICY, "reject"));
        return new PayloadLimit(max, unit, unit == Unit.CHARACTERS && truncateRequested);
    }

    public long sizeOf(String text) {
        return unit == Unit.BYTES ? text.getBytes(StandardCharsets.UTF_8).length : text.length();
    }

    public boolean exceededBy(long size) {
        return size > max;
    }
}
