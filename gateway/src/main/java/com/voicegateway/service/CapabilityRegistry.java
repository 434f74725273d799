package com.voicegateway.service;

import com.voicegateway.exception.ConfigConflictException;
import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.model.ActiveConfiguration;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.ProviderAdapter;
import com.voicegateway.provider.ProviderCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the adapter currently serving each capability.
 *
 * <p>Readers do a single reference load, so a request sees either the complete old adapter
 * set or the complete new one. {@link #publish} builds every adapter of the new snapshot
 * before swapping; adapters of the replaced snapshot are dropped, never reused.
 */
@Slf4j
@Component
public class CapabilityRegistry {

    private final ProviderCatalog catalog;
    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);

    public CapabilityRegistry(ProviderCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @throws ConfigValidationException if no configuration has been published yet
     */
    public ProviderAdapter resolve(CapabilityKind kind) {
        ProviderAdapter adapter = current.get().adapters().get(kind);
        if (adapter == null) {
            throw new ConfigValidationException(kind.key() + ".provider", "no provider configured");
        }
        return adapter;
    }

    public <A extends ProviderAdapter> A resolve(CapabilityKind kind, Class<A> adapterType) {
        return bind(kind, adapterType).adapter();
    }

    /**
     * Adapter of the capability together with the descriptor it was built from, read from
     * the same snapshot.
     *
     * @throws ConfigValidationException if no configuration has been published yet
     */
    public <A extends ProviderAdapter> Binding<A> bind(CapabilityKind kind, Class<A> adapterType) {
        Snapshot snapshot = current.get();
        ProviderAdapter adapter = snapshot.adapters().get(kind);
        if (adapter == null) {
            throw new ConfigValidationException(kind.key() + ".provider", "no provider configured");
        }
        if (!adapterType.isInstance(adapter)) {
            throw new IllegalStateException("Adapter " + adapter.getName() + " registered for "
                    + kind.key() + " does not implement " + adapterType.getSimpleName());
        }
        return new Binding<>(adapterType.cast(adapter), snapshot.descriptors().get(kind));
    }

    public long currentVersion() {
        return current.get().version();
    }

    public Optional<String> activeProvider(CapabilityKind kind) {
        return Optional.ofNullable(current.get().adapters().get(kind)).map(ProviderAdapter::getName);
    }

    /**
     * Builds adapters for every capability of the configuration and makes them visible to
     * subsequent requests.
     *
     * @throws ConfigConflictException   if the version is not newer than the published one
     * @throws ConfigValidationException if an adapter cannot be constructed
     */
    public void publish(ActiveConfiguration configuration) {
        Snapshot existing = current.get();
        if (configuration.getVersion() <= existing.version()) {
            throw new ConfigConflictException(configuration.getVersion(), existing.version());
        }

        Map<CapabilityKind, ProviderAdapter> adapters = new EnumMap<>(CapabilityKind.class);
        Map<CapabilityKind, AdapterDescriptor> descriptors = new EnumMap<>(CapabilityKind.class);
        for (CapabilityKind kind : CapabilityKind.values()) {
            AdapterDescriptor descriptor = configuration.activeDescriptor(kind)
                    .orElseThrow(() -> new ConfigValidationException(kind.key() + ".provider", "no provider selected"));
            try {
                adapters.put(kind, catalog.create(descriptor));
                descriptors.put(kind, descriptor);
            } catch (RuntimeException e) {
                throw new ConfigValidationException(kind.key() + ".provider",
                        "cannot build adapter " + descriptor.getProviderName() + ": " + e.getMessage());
            }
        }

        Snapshot next = new Snapshot(configuration.getVersion(),
                Collections.unmodifiableMap(adapters), Collections.unmodifiableMap(descriptors));
        if (!current.compareAndSet(existing, next)) {
            throw new ConfigConflictException(configuration.getVersion(), current.get().version());
        }
        log.info("Published configuration version {}: transcription={}, synthesis={}, generation={}",
                next.version(),
                adapters.get(CapabilityKind.TRANSCRIPTION).getName(),
                adapters.get(CapabilityKind.SYNTHESIS).getName(),
                adapters.get(CapabilityKind.GENERATION).getName());
    }

    public record Binding<A extends ProviderAdapter>(A adapter, AdapterDescriptor descriptor) {
    }

    private record Snapshot(long version, Map<CapabilityKind, ProviderAdapter> adapters,
                            Map<CapabilityKind, AdapterDescriptor> descriptors) {
        static final Snapshot EMPTY = new Snapshot(0, Map.of(), Map.of());
    }
}
