package com.voicegateway.provider.azure;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.AdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

import static com.voicegateway.provider.AbstractHttpAdapter.clientFor;

/**
 * Azure Cognitive Services Speech. Endpoints are regional, so the region is required
 * alongside the subscription key.
 */
@Configuration
public class AzureAdapters {

    public static final String PROVIDER_NAME = "azure";
    public static final String SPEECH_KEY = "speech_key";
    public static final String REGION = "region";

    private static final Set<String> REQUIRED = Set.of(SPEECH_KEY, REGION);

    @Bean
    public AdapterFactory azureTranscriptionFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.TRANSCRIPTION, PROVIDER_NAME, REQUIRED,
                descriptor -> new AzureTranscriptionAdapter(
                        client(webClientBuilder, descriptor, "stt"), descriptor));
    }

    @Bean
    public AdapterFactory azureSynthesisFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.SYNTHESIS, PROVIDER_NAME, REQUIRED,
                descriptor -> new AzureSynthesisAdapter(
                        client(webClientBuilder, descriptor, "tts"), descriptor));
    }

    private static WebClient client(WebClient.Builder webClientBuilder, AdapterDescriptor descriptor, String service) {
        String regionalUrl = "https://" + descriptor.credential(REGION) + "." + service + ".speech.microsoft.com";
        return clientFor(webClientBuilder, descriptor, regionalUrl)
                .defaultHeader("Ocp-Apim-Subscription-Key", descriptor.credential(SPEECH_KEY))
                .build();
    }
}
