package com.voicegateway.provider;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.testutil.FakeGenerationAdapter;
import com.voicegateway.testutil.FakeSynthesisAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderCatalogTest {

    private final ProviderCatalog catalog = new ProviderCatalog(List.of(
            AdapterFactory.of(CapabilityKind.GENERATION, "OpenAI", Set.of("api_key"), d -> new FakeGenerationAdapter("openai", "x")),
            AdapterFactory.of(CapabilityKind.GENERATION, "ollama", Set.of(), d -> new FakeGenerationAdapter("ollama", "x")),
            AdapterFactory.of(CapabilityKind.SYNTHESIS, "mismatched", Set.of(), d -> new FakeGenerationAdapter("mismatched", "x")),
            AdapterFactory.of(CapabilityKind.SYNTHESIS, "openai", Set.of("api_key"), d -> new FakeSynthesisAdapter("openai"))));

    @Test
    void shouldFindProvidersCaseInsensitivelyPerCapability() {
        assertThat(catalog.find(CapabilityKind.GENERATION, " openai ")).isPresent();
        assertThat(catalog.find(CapabilityKind.GENERATION, "OLLAMA")).isPresent();
        assertThat(catalog.find(CapabilityKind.TRANSCRIPTION, "openai")).isEmpty();
        assertThat(catalog.find(CapabilityKind.GENERATION, null)).isEmpty();
        assertThat(catalog.providerNames(CapabilityKind.GENERATION)).containsExactly("ollama", "openai");
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        assertThatThrownBy(() -> new ProviderCatalog(List.of(
                AdapterFactory.of(CapabilityKind.GENERATION, "openai", Set.of(), d -> new FakeGenerationAdapter("openai", "x")),
                AdapterFactory.of(CapabilityKind.GENERATION, "OpenAI", Set.of(), d -> new FakeGenerationAdapter("openai", "y")))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("generation/openai");
    }

    @Test
    void shouldBuildNewAdapterForEveryCall() {
        AdapterDescriptor descriptor = AdapterDescriptor.builder()
                .capability(CapabilityKind.GENERATION).providerName("ollama").build();

        assertThat(catalog.create(descriptor)).isNotSameAs(catalog.create(descriptor));
    }

    @Test
    void shouldRefuseAdapterOfWrongCapability() {
        AdapterDescriptor descriptor = AdapterDescriptor.builder()
                .capability(CapabilityKind.SYNTHESIS).providerName("mismatched").build();

        assertThatThrownBy(() -> catalog.create(descriptor)).isInstanceOf(IllegalArgumentException.class);
    }
}
