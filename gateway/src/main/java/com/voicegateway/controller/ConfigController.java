package com.voicegateway.controller;

import com.voicegateway.model.ActiveConfiguration;
import com.voicegateway.model.ConfigModels;
import com.voicegateway.service.ConfigStore;
import com.voicegateway.service.LegacyConfigTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Runtime configuration used by the management app. Changes take effect for the next
 * request without a restart.
 */
@Slf4j
@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
public class ConfigController {

    private final ConfigStore configStore;
    private final LegacyConfigTranslator legacyTranslator;

    /**
     * Accepts either {@code {"capabilities": {...}}} or the flat {@code {"config": {...}}} form
     */
    @PostMapping
    public Mono<ConfigModels.ConfigUpdateResponse> updateConfig(@RequestBody ConfigModels.ConfigUpdateRequest request) {
        return Mono.fromCallable(() -> {
            ConfigModels.ConfigUpdate update = request.getConfig() != null
                    ? legacyTranslator.translate(request.getConfig(), request.getExpectedVersion())
                    : ConfigModels.ConfigUpdate.builder()
                            .expectedVersion(request.getExpectedVersion())
                            .capabilities(request.getCapabilities())
                            .build();
            ActiveConfiguration applied = configStore.applyUpdate(update);
            return ConfigModels.ConfigUpdateResponse.builder()
                    .status("success")
                    .message("Configuration updated")
                    .version(applied.getVersion())
                    .build();
        });
    }

    @GetMapping
    public Mono<Map<String, Object>> getConfig() {
        return Mono.fromSupplier(configStore::sanitizedView);
    }
}
