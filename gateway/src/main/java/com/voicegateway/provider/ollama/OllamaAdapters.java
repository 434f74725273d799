package com.voicegateway.provider.ollama;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.AdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

import static com.voicegateway.provider.AbstractHttpAdapter.clientFor;

/**
 * Local models served by Ollama. No credentials.
 */
@Configuration
public class OllamaAdapters {

    public static final String PROVIDER_NAME = "ollama";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";

    @Bean
    public AdapterFactory ollamaGenerationFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.GENERATION, PROVIDER_NAME, Set.of(),
                descriptor -> new OllamaGenerationAdapter(
                        clientFor(webClientBuilder, descriptor, DEFAULT_BASE_URL).build(), descriptor));
    }
}
