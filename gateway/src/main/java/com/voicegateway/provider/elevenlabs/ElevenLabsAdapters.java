package com.voicegateway.provider.elevenlabs;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.AdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

import static com.voicegateway.provider.AbstractHttpAdapter.clientFor;

@Configuration
public class ElevenLabsAdapters {

    public static final String PROVIDER_NAME = "elevenlabs";
    public static final String API_KEY = "api_key";
    static final String DEFAULT_BASE_URL = "https://api.elevenlabs.io/v1";

    @Bean
    public AdapterFactory elevenLabsSynthesisFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.SYNTHESIS, PROVIDER_NAME, Set.of(API_KEY),
                descriptor -> new ElevenLabsSynthesisAdapter(
                        clientFor(webClientBuilder, descriptor, DEFAULT_BASE_URL)
                                .defaultHeader("xi-api-key", descriptor.credential(API_KEY))
                                .build(),
                        descriptor));
    }
}
