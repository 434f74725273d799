package com.voicegateway.provider.anthropic;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.AdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

import static com.voicegateway.provider.AbstractHttpAdapter.clientFor;

@Configuration
public class AnthropicAdapters {

    public static final String PROVIDER_NAME = "anthropic";
    public static final String API_KEY = "api_key";
    static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    static final String API_VERSION = "2023-06-01";

    @Bean
    public AdapterFactory anthropicGenerationFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.GENERATION, PROVIDER_NAME, Set.of(API_KEY),
                descriptor -> new AnthropicGenerationAdapter(
                        clientFor(webClientBuilder, descriptor, DEFAULT_BASE_URL)
                                .defaultHeader("x-api-key", descriptor.credential(API_KEY))
                                .defaultHeader("anthropic-version", API_VERSION)
                                .build(),
                        descriptor));
    }
}
