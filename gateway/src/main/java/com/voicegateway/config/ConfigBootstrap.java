package com.voicegateway.config;

import com.voicegateway.exception.ConfigConflictException;
import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.model.ActiveConfiguration;
import com.voicegateway.model.ConfigModels;
import com.voicegateway.service.ConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code voice-gateway.capabilities} seed as the first configuration version.
 * A seed that fails validation leaves the service unconfigured but running, so the
 * management app can still push a configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigBootstrap implements ApplicationRunner {

    private final GatewayProperties properties;
    private final ConfigStore configStore;

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getCapabilities().isEmpty()) {
            log.info("No capability seed configured, waiting for a configuration update");
            return;
        }
        try {
            ActiveConfiguration applied = configStore.applyUpdate(seedUpdate());
            log.info("Seed configuration applied as version {}", applied.getVersion());
        } catch (ConfigValidationException e) {
            log.error("Seed configuration rejected at field '{}': {}. Capabilities stay unconfigured.",
                    e.getField(), e.getMessage());
        } catch (ConfigConflictException e) {
            log.warn("Seed configuration skipped, version {} was already committed", e.getCurrentVersion());
        }
    }

    ConfigModels.ConfigUpdate seedUpdate() {
        Map<String, ConfigModels.CapabilityUpdate> capabilities = new LinkedHashMap<>();
        properties.getCapabilities().forEach((name, seed) -> {
            String provider = seed.getProvider();
            GatewayProperties.ProviderSettings settings = provider == null
                    ? null
                    : seed.getProviders().get(provider);
            capabilities.put(name, ConfigModels.CapabilityUpdate.builder()
                    .provider(provider)
                    .credentials(settings == null ? null : withoutBlanks(settings.getCredentials()))
                    .parameters(settings == null ? null : withoutBlanks(settings.getParameters()))
                    .build());
        });
        return ConfigModels.ConfigUpdate.builder()
                .expectedVersion(ActiveConfiguration.empty().getVersion())
                .capabilities(capabilities)
                .build();
    }

    // unset environment placeholders resolve to empty strings
    private static Map<String, String> withoutBlanks(Map<String, String> values) {
        Map<String, String> filtered = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }
}
