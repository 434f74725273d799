package com.voicegateway.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything needed to construct one vendor adapter. Immutable: a reconfiguration
 * produces a new descriptor (and a new adapter), credentials are never edited in place.
 */
@Value
public class AdapterDescriptor {

    CapabilityKind capability;

    String providerName;

    @ToString.Exclude
    Map<String, String> credentials;

    Map<String, String> endpointParameters;

    @Builder
    private AdapterDescriptor(@NonNull CapabilityKind capability,
                              @NonNull String providerName,
                              Map<String, String> credentials,
                              Map<String, String> endpointParameters) {
        this.capability = capability;
        this.providerName = providerName;
        this.credentials = freeze(credentials);
        this.endpointParameters = freeze(endpointParameters);
    }

    public String credential(String key) {
        return credentials.get(key);
    }

    public String parameter(String key, String defaultValue) {
        String value = endpointParameters.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    public int intParameter(String key, int defaultValue) {
        String value = endpointParameters.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public double doubleParameter(String key, double defaultValue) {
        String value = endpointParameters.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Provider name and endpoint parameters in a stable order. Two descriptors with the same
     * key drive the vendor identically; credentials are not part of it.
     */
    public String settingsKey() {
        StringBuilder sb = new StringBuilder(providerName).append('|');
        new TreeMap<>(endpointParameters).forEach((key, value) -> sb.append(key).append('=').append(value).append(';'));
        return sb.toString();
    }

    /**
     * Returns a new descriptor with the given credentials and parameters merged key by key.
     * A {@code null} value removes the key.
     */
    public AdapterDescriptor withChanges(Map<String, String> credentialChanges,
                                         Map<String, String> parameterChanges) {
        return new AdapterDescriptor(capability, providerName,
                merge(credentials, credentialChanges),
                merge(endpointParameters, parameterChanges));
    }

    private static Map<String, String> merge(Map<String, String> base, Map<String, String> changes) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        if (changes != null) {
            changes.forEach((key, value) -> {
                if (value == null) {
                    merged.remove(key);
                } else {
                    merged.put(key, value);
                }
            });
        }
        return merged;
    }

    private static Map<String, String> freeze(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
