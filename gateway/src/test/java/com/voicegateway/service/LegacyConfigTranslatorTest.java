package com.voicegateway.service;

import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.model.ActiveConfiguration;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.ConfigModels;
import com.voicegateway.testutil.GatewayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LegacyConfigTranslatorTest {

    private GatewayFixture fixture;
    private LegacyConfigTranslator translator;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture();
        fixture.configureDefaults();
        translator = new LegacyConfigTranslator(fixture.catalog, fixture.configStore);
    }

    private static Map<String, Object> flat(Object... keyValues) {
        Map<String, Object> config = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            config.put((String) keyValues[i], keyValues[i + 1]);
        }
        return config;
    }

    @Test
    void shouldSplitProviderCredentialsFromParameters() {
        ConfigModels.ConfigUpdate update = translator.translate(flat(
                "llm.provider", "anthropic",
                "llm.anthropic_api_key", "sk-ant-1",
                "llm.temperature", 0.3), null);

        ConfigModels.CapabilityUpdate generation = update.getCapabilities().get("generation");
        assertThat(update.getCapabilities()).containsOnlyKeys("generation");
        assertThat(generation.getProvider()).isEqualTo("anthropic");
        assertThat(generation.getCredentials()).containsExactly(Map.entry("api_key", "sk-ant-1"));
        assertThat(generation.getParameters()).containsExactly(Map.entry("temperature", "0.3"));
        assertThat(update.getExpectedVersion()).isNull();
    }

    @Test
    void shouldTreatRequiredNonKeySettingsAsCredentials() {
        ConfigModels.ConfigUpdate update = translator.translate(flat(
                "tts.provider", "azure",
                "tts.azure_speech_key", "az-1",
                "tts.azure_region", "westeurope",
                "tts.azure_voice", "en-US-JennyNeural"), 4L);

        ConfigModels.CapabilityUpdate synthesis = update.getCapabilities().get("synthesis");
        assertThat(synthesis.getCredentials())
                .containsEntry("speech_key", "az-1")
                .containsEntry("region", "westeurope")
                .hasSize(2);
        assertThat(synthesis.getParameters()).containsExactly(Map.entry("voice", "en-US-JennyNeural"));
        assertThat(update.getExpectedVersion()).isEqualTo(4L);
    }

    @Test
    void shouldIgnoreSettingsOfProvidersNotBeingConfigured() {
        ConfigModels.ConfigUpdate update = translator.translate(flat(
                "llm.provider", "anthropic",
                "llm.anthropic_api_key", "sk-ant-1",
                "llm.openai_api_key", "sk-other"), null);

        assertThat(update.getCapabilities().get("generation").getCredentials())
                .containsExactly(Map.entry("api_key", "sk-ant-1"));
    }

    @Test
    void shouldTargetCurrentProviderWhenNoneSelected() {
        ConfigModels.ConfigUpdate update = translator.translate(flat(
                "stt.openai_api_key", "sk-new",
                "stt.google_api_key", "g-ignored"), null);

        ConfigModels.CapabilityUpdate transcription = update.getCapabilities().get("transcription");
        assertThat(transcription.getProvider()).isNull();
        assertThat(transcription.getCredentials()).containsExactly(Map.entry("api_key", "sk-new"));
    }

    @Test
    void shouldSkipMaskedValuesEchoedFromSanitizedView() {
        ConfigModels.ConfigUpdate update = translator.translate(flat(
                "llm.openai_api_key", "***",
                "llm.model", "gpt-4o"), null);

        ConfigModels.CapabilityUpdate generation = update.getCapabilities().get("generation");
        assertThat(generation.getCredentials()).isNull();
        assertThat(generation.getParameters()).containsExactly(Map.entry("model", "gpt-4o"));
    }

    @Test
    void shouldRejectUnknownCapabilityPrefix() {
        assertThatThrownBy(() -> translator.translate(flat("vision.provider", "openai"), null))
                .isInstanceOfSatisfying(ConfigValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("vision.provider"));
    }

    @Test
    void shouldRejectKeyWithoutSetting() {
        assertThatThrownBy(() -> translator.translate(flat("provider", "openai"), null))
                .isInstanceOfSatisfying(ConfigValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("provider"));
        assertThatThrownBy(() -> translator.translate(Map.of(), null))
                .isInstanceOfSatisfying(ConfigValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("config"));
    }

    @Test
    void shouldApplyTranslatedUpdateThroughConfigStore() {
        ConfigModels.ConfigUpdate update = translator.translate(flat(
                "llm.provider", "anthropic",
                "llm.anthropic_api_key", "sk-ant-1"), null);

        ActiveConfiguration applied = fixture.configStore.applyUpdate(update);

        assertThat(applied.getVersion()).isEqualTo(2);
        assertThat(applied.selectedProvider(CapabilityKind.GENERATION)).contains("anthropic");
        assertThat(fixture.registry.resolve(CapabilityKind.GENERATION)).isSameAs(fixture.anthropicGeneration);
    }

    @Test
    void shouldReportMissingCredentialOfTranslatedProvider() {
        ConfigModels.ConfigUpdate update = translator.translate(flat("llm.provider", "anthropic"), null);

        assertThatThrownBy(() -> fixture.configStore.applyUpdate(update))
                .isInstanceOfSatisfying(ConfigValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("generation.credentials.api_key"));
    }
}
