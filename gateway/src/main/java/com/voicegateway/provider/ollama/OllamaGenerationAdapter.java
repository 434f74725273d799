package com.voicegateway.provider.ollama;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.GenerationAdapter;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.PromptSupport;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Non-streaming {@code /api/generate}. Accepts up to 8,000 characters of user input,
 * which keeps the assembled prompt inside a default 4k-token context.
 */
@Slf4j
public class OllamaGenerationAdapter extends AbstractHttpAdapter implements GenerationAdapter {

    static final String DEFAULT_MODEL = "llama2";
    private static final int MAX_INPUT_CHARACTERS = 8_000;

    public OllamaGenerationAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.GenerationResult> generate(VoiceModels.GenerationRequest request) {
        String model = descriptor.parameter("model", DEFAULT_MODEL);
        log.debug("Ollama generate request: model={}", model);

        Map<String, Object> body = Map.of(
                "model", model,
                "prompt", PromptSupport.completionPrompt(descriptor, request),
                "stream", false,
                "options", Map.of(
                        "temperature", descriptor.doubleParameter("temperature", 0.7),
                        "num_predict", descriptor.intParameter("max_tokens", 150)));

        return execute("generate", webClient.post()
                .uri("/api/generate")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GenerateResponse.class)
                .map(response -> VoiceModels.GenerationResult.builder()
                        .responseText(requireText(response.getResponse(), "response").trim())
                        .build()));
    }

    @Data
    @NoArgsConstructor
    public static class GenerateResponse {
        private String model;
        private String response;
        private Boolean done;
    }
}
