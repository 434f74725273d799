package com.voicegateway.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned view of which provider serves each capability and how every known
 * provider is configured. Version 0 is the unconfigured snapshot the store starts from.
 */
@Value
public class ActiveConfiguration {

    private static final ActiveConfiguration EMPTY = new ActiveConfiguration(0, Map.of(), Map.of());

    long version;

    Map<CapabilityKind, String> selections;

    Map<CapabilityKind, Map<String, AdapterDescriptor>> descriptors;

    public ActiveConfiguration(long version,
                               Map<CapabilityKind, String> selections,
                               Map<CapabilityKind, Map<String, AdapterDescriptor>> descriptors) {
        this.version = version;
        this.selections = selections.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(selections));
        Map<CapabilityKind, Map<String, AdapterDescriptor>> copy = new EnumMap<>(CapabilityKind.class);
        descriptors.forEach((kind, byProvider) ->
                copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(byProvider))));
        this.descriptors = Collections.unmodifiableMap(copy);
    }

    public static ActiveConfiguration empty() {
        return EMPTY;
    }

    public Optional<String> selectedProvider(CapabilityKind kind) {
        return Optional.ofNullable(selections.get(kind));
    }

    public Optional<AdapterDescriptor> descriptor(CapabilityKind kind, String providerName) {
        return Optional.ofNullable(descriptors.getOrDefault(kind, Map.of()).get(providerName));
    }

    /**
     * Descriptor of the provider currently selected for the capability
     */
    public Optional<AdapterDescriptor> activeDescriptor(CapabilityKind kind) {
        return selectedProvider(kind).flatMap(name -> descriptor(kind, name));
    }

    public Map<String, AdapterDescriptor> descriptorsFor(CapabilityKind kind) {
        return descriptors.getOrDefault(kind, Map.of());
    }

    public boolean isConfigured() {
        return version > 0;
    }
}
