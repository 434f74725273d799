package com.voicegateway.provider.google;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.AdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

import static com.voicegateway.provider.AbstractHttpAdapter.clientFor;

/**
 * Google Cloud Speech-to-Text and Text-to-Speech over REST with an API key.
 */
@Configuration
public class GoogleAdapters {

    public static final String PROVIDER_NAME = "google";
    public static final String API_KEY = "api_key";
    static final String SPEECH_BASE_URL = "https://speech.googleapis.com";
    static final String TEXT_TO_SPEECH_BASE_URL = "https://texttospeech.googleapis.com";

    private static final Set<String> REQUIRED = Set.of(API_KEY);

    @Bean
    public AdapterFactory googleTranscriptionFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.TRANSCRIPTION, PROVIDER_NAME, REQUIRED,
                descriptor -> new GoogleTranscriptionAdapter(
                        client(webClientBuilder, descriptor, SPEECH_BASE_URL), descriptor));
    }

    @Bean
    public AdapterFactory googleSynthesisFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.SYNTHESIS, PROVIDER_NAME, REQUIRED,
                descriptor -> new GoogleSynthesisAdapter(
                        client(webClientBuilder, descriptor, TEXT_TO_SPEECH_BASE_URL), descriptor));
    }

    // header rather than ?key= keeps the key out of logged request URIs
    private static WebClient client(WebClient.Builder webClientBuilder, AdapterDescriptor descriptor, String baseUrl) {
        return clientFor(webClientBuilder, descriptor, baseUrl)
                .defaultHeader("X-Goog-Api-Key", descriptor.credential(API_KEY))
                .build();
    }
}
