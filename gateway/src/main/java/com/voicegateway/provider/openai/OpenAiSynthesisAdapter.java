package com.voicegateway.provider.openai;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.AudioFormats;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.SynthesisAdapter;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Speech endpoint, limited to 4,096 characters of input per request.
 */
public class OpenAiSynthesisAdapter extends AbstractHttpAdapter implements SynthesisAdapter {

    static final String DEFAULT_MODEL = "tts-1";
    static final String DEFAULT_VOICE = "alloy";
    private static final int MAX_INPUT_CHARACTERS = 4096;

    public OpenAiSynthesisAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.SynthesisResult> synthesize(VoiceModels.SynthesisRequest request) {
        String format = descriptor.parameter("response_format", "wav");

        Map<String, Object> body = new HashMap<>();
        body.put("model", descriptor.parameter("model", DEFAULT_MODEL));
        body.put("voice", request.getVoiceHint() != null ? request.getVoiceHint() : descriptor.parameter("voice", DEFAULT_VOICE));
        body.put("input", request.getText());
        body.put("response_format", format);
        body.put("speed", descriptor.doubleParameter("speed", 1.0));

        return execute("synthesize", webClient.post()
                .uri("/audio/speech")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(byte[].class)
                .map(audio -> VoiceModels.SynthesisResult.builder()
                        .audio(requireAudio(audio))
                        .mimeType(AudioFormats.mimeType(format))
                        .build()));
    }
}
