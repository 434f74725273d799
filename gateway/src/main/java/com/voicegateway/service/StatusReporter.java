package com.voicegateway.service;

import com.voicegateway.exception.ErrorKind;
import com.voicegateway.model.CapabilityHealth;
import com.voicegateway.model.CapabilityKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks the last success and failure per capability and provider. Concurrent completions are
 * merged field by field, keeping the later timestamp, so an out-of-order write never hides a
 * fresher outcome. Only the record of the provider currently active for a capability is
 * reported; switching providers shows the new one as {@code UNKNOWN} until it completes a request.
 */
@Component
public class StatusReporter {

    private final CapabilityRegistry registry;
    private final ConcurrentMap<RecordKey, CapabilityHealth> records = new ConcurrentHashMap<>();

    public StatusReporter(CapabilityRegistry registry) {
        this.registry = registry;
    }

    public void recordSuccess(CapabilityKind kind, String providerName, Instant at) {
        CapabilityHealth observed = CapabilityHealth.builder()
                .capability(kind)
                .providerName(providerName)
                .lastSuccess(at)
                .build();
        records.merge(new RecordKey(kind, providerName), observed, StatusReporter::freshest);
    }

    public void recordFailure(CapabilityKind kind, String providerName, ErrorKind errorKind, Instant at) {
        CapabilityHealth observed = CapabilityHealth.builder()
                .capability(kind)
                .providerName(providerName)
                .lastFailure(at)
                .lastErrorKind(errorKind)
                .build();
        records.merge(new RecordKey(kind, providerName), observed, StatusReporter::freshest);
    }

    /**
     * Health of every capability. Capabilities that have not completed a request yet report
     * the currently active provider in the {@code UNKNOWN} state.
     */
    public Map<CapabilityKind, CapabilityHealth> report() {
        Map<CapabilityKind, CapabilityHealth> report = new EnumMap<>(CapabilityKind.class);
        for (CapabilityKind kind : CapabilityKind.values()) {
            report.put(kind, health(kind));
        }
        return Collections.unmodifiableMap(report);
    }

    public CapabilityHealth health(CapabilityKind kind) {
        String active = registry.activeProvider(kind).orElse(null);
        CapabilityHealth recorded = records.get(new RecordKey(kind, active));
        if (recorded != null) {
            return recorded;
        }
        return CapabilityHealth.unknown(kind, active);
    }

    static CapabilityHealth freshest(CapabilityHealth current, CapabilityHealth observed) {
        Instant success = later(current.getLastSuccess(), observed.getLastSuccess());
        Instant failure = later(current.getLastFailure(), observed.getLastFailure());
        ErrorKind errorKind = failure != null && failure.equals(observed.getLastFailure())
                ? observed.getLastErrorKind()
                : current.getLastErrorKind();
        return current.toBuilder()
                .lastSuccess(success)
                .lastFailure(failure)
                .lastErrorKind(errorKind)
                .build();
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.isAfter(a) ? b : a;
    }

    // providerName is null for requests rejected while the capability had no provider
    private record RecordKey(CapabilityKind kind, String providerName) {
    }
}
