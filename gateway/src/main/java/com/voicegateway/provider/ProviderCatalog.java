package com.voicegateway.provider;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lookup table of every known adapter constructor, keyed by capability and provider name.
 * Provider selection goes through this table; call sites never branch on provider strings.
 */
@Slf4j
@Component
public class ProviderCatalog {

    private final Map<CapabilityKind, Map<String, AdapterFactory>> factories = new EnumMap<>(CapabilityKind.class);

    public ProviderCatalog(List<AdapterFactory> adapterFactories) {
        for (CapabilityKind kind : CapabilityKind.values()) {
            factories.put(kind, new TreeMap<>());
        }
        for (AdapterFactory factory : adapterFactories) {
            String name = normalize(factory.providerName());
            AdapterFactory previous = factories.get(factory.capability()).putIfAbsent(name, factory);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter registration for "
                        + factory.capability().key() + "/" + name);
            }
        }
        factories.forEach((kind, byName) ->
                log.info("Registered {} providers: {}", kind.key(), byName.keySet()));
    }

    public Optional<AdapterFactory> find(CapabilityKind kind, String providerName) {
        if (providerName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(kind).get(normalize(providerName)));
    }

    public Set<String> providerNames(CapabilityKind kind) {
        return Collections.unmodifiableSet(factories.get(kind).keySet());
    }

    /**
     * Constructs a new adapter for the descriptor.
     *
     * @throws IllegalArgumentException if no factory is registered or the factory built an
     *                                  adapter for a different capability
     */
    public ProviderAdapter create(AdapterDescriptor descriptor) {
        AdapterFactory factory = find(descriptor.getCapability(), descriptor.getProviderName())
                .orElseThrow(() -> new IllegalArgumentException("No adapter registered for "
                        + descriptor.getCapability().key() + "/" + descriptor.getProviderName()));
        ProviderAdapter adapter = factory.create(descriptor);
        if (adapter.getCapability() != descriptor.getCapability()) {
            throw new IllegalArgumentException(factory + " built an adapter for " + adapter.getCapability());
        }
        return adapter;
    }

    public static String normalize(String providerName) {
        return providerName.trim().toLowerCase(Locale.ROOT);
    }
}
