package com.voicegateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.voicegateway.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Last observed outcome for one capability. A record with neither timestamp set means no
 * request has completed yet, which is distinct from both healthy and failed.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class CapabilityHealth {

    public enum State { UNKNOWN, OK, FAILED }

    CapabilityKind capability;

    String providerName;

    @JsonProperty("last_success")
    Instant lastSuccess;

    @JsonProperty("last_failure")
    Instant lastFailure;

    @JsonProperty("last_error_kind")
    ErrorKind lastErrorKind;

    public static CapabilityHealth unknown(CapabilityKind capability, String providerName) {
        return CapabilityHealth.builder()
                .capability(capability)
                .providerName(providerName)
                .build();
    }

    @JsonProperty("state")
    public State state() {
        if (lastSuccess == null && lastFailure == null) {
            return State.UNKNOWN;
        }
        if (lastFailure == null || (lastSuccess != null && lastSuccess.isAfter(lastFailure))) {
            return State.OK;
        }
        return State.FAILED;
    }
}
