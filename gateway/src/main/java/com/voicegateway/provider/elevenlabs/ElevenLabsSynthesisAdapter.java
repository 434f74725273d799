package com.voicegateway.provider.elevenlabs;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.SynthesisAdapter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Text-to-speech by voice id. Input is limited to 5,000 characters; output is MP3.
 */
public class ElevenLabsSynthesisAdapter extends AbstractHttpAdapter implements SynthesisAdapter {

    // "Adam"
    static final String DEFAULT_VOICE_ID = "pNInz6obpgDQGcFmaJgB";
    static final String DEFAULT_MODEL = "eleven_monolingual_v1";
    private static final int MAX_INPUT_CHARACTERS = 5000;

    public ElevenLabsSynthesisAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.SynthesisResult> synthesize(VoiceModels.SynthesisRequest request) {
        String voiceId = request.getVoiceHint() != null ? request.getVoiceHint() : descriptor.parameter("voice", DEFAULT_VOICE_ID);

        Map<String, Object> body = Map.of(
                "text", request.getText(),
                "model_id", descriptor.parameter("model", DEFAULT_MODEL));

        return execute("synthesize", webClient.post()
                .uri("/text-to-speech/{voiceId}", voiceId)
                .header(HttpHeaders.ACCEPT, "audio/mpeg")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(byte[].class)
                .map(audio -> VoiceModels.SynthesisResult.builder()
                        .audio(requireAudio(audio))
                        .mimeType("audio/mpeg")
                        .build()));
    }
}
