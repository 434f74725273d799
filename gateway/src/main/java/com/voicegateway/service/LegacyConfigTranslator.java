package com.voicegateway.service;

import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.ConfigModels;
import com.voicegateway.provider.AdapterFactory;
import com.voicegateway.provider.ProviderCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the flat dot-notation payload of the management app into a structured update.
 *
 * <p>Keys look like {@code llm.provider}, {@code llm.anthropic_api_key},
 * {@code tts.azure_region} or {@code llm.temperature}. A key prefixed with a provider name
 * belongs to that provider: it becomes a credential when the provider requires it or the
 * name ends in {@code key}, otherwise a parameter. Unprefixed keys are parameters of the
 * provider the update selects. Masked values ({@code ***}) echoed back from
 * {@code GET /api/config} are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyConfigTranslator {

    private static final String PROVIDER_KEY = "provider";

    private final ProviderCatalog catalog;
    private final ConfigStore configStore;

    public ConfigModels.ConfigUpdate translate(Map<String, Object> flatConfig, Long expectedVersion) {
        if (flatConfig == null || flatConfig.isEmpty()) {
            throw new ConfigValidationException("config", "must contain at least one setting");
        }

        Map<CapabilityKind, Map<String, String>> grouped = new EnumMap<>(CapabilityKind.class);
        flatConfig.forEach((key, value) -> {
            int dot = key == null ? -1 : key.indexOf('.');
            if (dot <= 0 || dot == key.length() - 1) {
                throw new ConfigValidationException(String.valueOf(key), "expected <capability>.<setting>");
            }
            CapabilityKind kind = CapabilityKind.lookup(key.substring(0, dot))
                    .orElseThrow(() -> new ConfigValidationException(key, "unknown capability"));
            String setting = key.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
            String text = value == null ? null : String.valueOf(value);
            if (ConfigStore.MASK.equals(text)) {
                return;
            }
            grouped.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(setting, text);
        });

        Map<String, ConfigModels.CapabilityUpdate> capabilities = new LinkedHashMap<>();
        grouped.forEach((kind, settings) -> capabilities.put(kind.key(), toCapabilityUpdate(kind, settings)));

        return ConfigModels.ConfigUpdate.builder()
                .expectedVersion(expectedVersion)
                .capabilities(capabilities)
                .build();
    }

    private ConfigModels.CapabilityUpdate toCapabilityUpdate(CapabilityKind kind, Map<String, String> settings) {
        String requested = settings.get(PROVIDER_KEY);
        String target = requested != null && !requested.isBlank()
                ? ProviderCatalog.normalize(requested)
                : configStore.getSnapshot().selectedProvider(kind).orElse(null);

        Map<String, String> credentials = new LinkedHashMap<>();
        Map<String, String> parameters = new LinkedHashMap<>();
        settings.forEach((setting, value) -> {
            if (PROVIDER_KEY.equals(setting)) {
                return;
            }
            Optional<AdapterFactory> owner = ownerOf(kind, setting);
            if (owner.isEmpty()) {
                parameters.put(setting, value);
                return;
            }
            AdapterFactory factory = owner.get();
            if (target != null && !factory.providerName().equals(target)) {
                log.info("Ignoring {}.{}: provider {} is not the one being configured", kind.legacyPrefix(),
                        setting, factory.providerName());
                return;
            }
            String name = setting.substring(factory.providerName().length() + 1);
            boolean credential = factory.requiredCredentials().contains(name) || name.endsWith("key");
            (credential ? credentials : parameters).put(name, value);
        });

        return ConfigModels.CapabilityUpdate.builder()
                .provider(requested)
                .credentials(credentials.isEmpty() ? null : credentials)
                .parameters(parameters.isEmpty() ? null : parameters)
                .build();
    }

    // longest provider-name prefix wins
    private Optional<AdapterFactory> ownerOf(CapabilityKind kind, String setting) {
        String best = null;
        for (String name : catalog.providerNames(kind)) {
            if (setting.startsWith(name + "_") && setting.length() > name.length() + 1
                    && (best == null || name.length() > best.length())) {
                best = name;
            }
        }
        return best == null ? Optional.empty() : catalog.find(kind, best);
    }
}
