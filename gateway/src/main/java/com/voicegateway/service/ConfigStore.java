package com.voicegateway.service;

import com.voicegateway.exception.ConfigConflictException;
import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.model.ActiveConfiguration;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.ConfigModels;
import com.voicegateway.provider.AdapterFactory;
import com.voicegateway.provider.ProviderCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active configuration. Updates are validated in full against the snapshot they
 * start from and committed only if that snapshot is still current; the registry is
 * republished before {@link #applyUpdate} returns.
 */
@Slf4j
@Service
public class ConfigStore {

    static final String MASK = "***";
    private static final Set<String> SENSITIVE_MARKERS = Set.of("key", "password", "secret", "token");

    private final ProviderCatalog catalog;
    private final CapabilityRegistry registry;
    private final AtomicReference<ActiveConfiguration> snapshot = new AtomicReference<>(ActiveConfiguration.empty());
    private final Object commitLock = new Object();

    public ConfigStore(ProviderCatalog catalog, CapabilityRegistry registry) {
        this.catalog = catalog;
        this.registry = registry;
    }

    public ActiveConfiguration getSnapshot() {
        return snapshot.get();
    }

    /**
     * Validates and applies a partial update.
     *
     * @return the new snapshot, whose version is exactly one above the previous one
     * @throws ConfigValidationException naming the first field that failed; nothing changed
     * @throws ConfigConflictException   if another update committed first or the expected
     *                                   version does not match
     */
    public ActiveConfiguration applyUpdate(ConfigModels.ConfigUpdate update) {
        ActiveConfiguration base = snapshot.get();
        Map<CapabilityKind, ConfigModels.CapabilityUpdate> changes = validateStructure(update);

        if (update.getExpectedVersion() != null && update.getExpectedVersion() != base.getVersion()) {
            throw new ConfigConflictException(update.getExpectedVersion() + 1, base.getVersion());
        }

        ActiveConfiguration next = merge(base, changes);

        synchronized (commitLock) {
            ActiveConfiguration latest = snapshot.get();
            if (latest.getVersion() != base.getVersion()) {
                throw new ConfigConflictException(next.getVersion(), latest.getVersion());
            }
            registry.publish(next);
            snapshot.set(next);
        }
        log.info("Configuration updated to version {} (changed: {})", next.getVersion(), changes.keySet());
        return next;
    }

    /**
     * Current configuration with every credential value and sensitive-looking parameter masked
     */
    public Map<String, Object> sanitizedView() {
        ActiveConfiguration config = snapshot.get();
        Map<String, Object> capabilities = new LinkedHashMap<>();
        for (CapabilityKind kind : CapabilityKind.values()) {
            Map<String, Object> providers = new LinkedHashMap<>();
            config.descriptorsFor(kind).forEach((name, descriptor) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("credentials", mask(descriptor.getCredentials(), true));
                entry.put("parameters", mask(descriptor.getEndpointParameters(), false));
                providers.put(name, entry);
            });
            Map<String, Object> capability = new LinkedHashMap<>();
            capability.put("provider", config.selectedProvider(kind).orElse(null));
            capability.put("providers", providers);
            capabilities.put(kind.key(), capability);
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("version", config.getVersion());
        view.put("capabilities", capabilities);
        return view;
    }

    // step 1: shape of the payload
    private Map<CapabilityKind, ConfigModels.CapabilityUpdate> validateStructure(ConfigModels.ConfigUpdate update) {
        if (update == null) {
            throw new ConfigValidationException("body", "update is required");
        }
        if (update.getExpectedVersion() != null && update.getExpectedVersion() < 0) {
            throw new ConfigValidationException("expected_version", "must not be negative");
        }
        if (update.getCapabilities() == null || update.getCapabilities().isEmpty()) {
            throw new ConfigValidationException("capabilities", "update must name at least one capability");
        }
        Map<CapabilityKind, ConfigModels.CapabilityUpdate> changes = new EnumMap<>(CapabilityKind.class);
        update.getCapabilities().forEach((name, change) -> {
            CapabilityKind kind = CapabilityKind.lookup(name)
                    .orElseThrow(() -> new ConfigValidationException(String.valueOf(name), "unknown capability"));
            if (change == null) {
                throw new ConfigValidationException(kind.key(), "must not be null");
            }
            if (change.getProvider() != null && change.getProvider().isBlank()) {
                throw new ConfigValidationException(kind.key() + ".provider", "must not be blank");
            }
            requireKeys(change.getCredentials(), kind.key() + ".credentials");
            requireKeys(change.getParameters(), kind.key() + ".parameters");
            if (changes.put(kind, change) != null) {
                throw new ConfigValidationException(kind.key(), "named more than once");
            }
        });
        return changes;
    }

    private ActiveConfiguration merge(ActiveConfiguration base, Map<CapabilityKind, ConfigModels.CapabilityUpdate> changes) {
        Map<CapabilityKind, String> selections = new EnumMap<>(CapabilityKind.class);
        selections.putAll(base.getSelections());
        Map<CapabilityKind, Map<String, AdapterDescriptor>> descriptors = new EnumMap<>(CapabilityKind.class);
        base.getDescriptors().forEach((kind, byProvider) -> descriptors.put(kind, new LinkedHashMap<>(byProvider)));

        // step 2: every requested provider has a registered adapter constructor
        Map<CapabilityKind, AdapterFactory> factories = new EnumMap<>(CapabilityKind.class);
        changes.forEach((kind, change) -> {
            String provider = change.getProvider() != null
                    ? ProviderCatalog.normalize(change.getProvider())
                    : base.selectedProvider(kind).orElseThrow(() ->
                            new ConfigValidationException(kind.key() + ".provider", "no provider selected yet"));
            AdapterFactory factory = catalog.find(kind, provider).orElseThrow(() ->
                    new ConfigValidationException(kind.key() + ".provider",
                            "unknown provider '" + provider + "', expected one of " + catalog.providerNames(kind)));
            factories.put(kind, factory);
        });

        // step 3: required credentials are present on the merged descriptor
        factories.forEach((kind, factory) -> {
            ConfigModels.CapabilityUpdate change = changes.get(kind);
            String provider = factory.providerName();
            AdapterDescriptor merged = base.descriptor(kind, provider)
                    .orElseGet(() -> AdapterDescriptor.builder().capability(kind).providerName(provider).build())
                    .withChanges(change.getCredentials(), change.getParameters());
            for (String key : factory.requiredCredentials()) {
                String value = merged.credential(key);
                if (value == null || value.isBlank()) {
                    throw new ConfigValidationException(kind.key() + ".credentials." + key,
                            "required by provider " + provider);
                }
            }
            descriptors.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(provider, merged);
            selections.put(kind, provider);
        });

        for (CapabilityKind kind : CapabilityKind.values()) {
            if (!selections.containsKey(kind)) {
                throw new ConfigValidationException(kind.key() + ".provider", "no provider configured");
            }
        }
        return new ActiveConfiguration(base.getVersion() + 1, selections, descriptors);
    }

    private static void requireKeys(Map<String, String> values, String field) {
        if (values == null) {
            return;
        }
        for (String key : values.keySet()) {
            if (key == null || key.isBlank()) {
                throw new ConfigValidationException(field, "keys must not be blank");
            }
        }
    }

    private static Map<String, String> mask(Map<String, String> values, boolean maskAll) {
        Map<String, String> masked = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            boolean sensitive = maskAll || SENSITIVE_MARKERS.stream()
                    .anyMatch(marker -> key.toLowerCase(Locale.ROOT).contains(marker));
            masked.put(key, sensitive && value != null && !value.isEmpty() ? MASK : value);
        });
        return masked;
    }
}
