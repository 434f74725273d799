package com.voicegateway.provider.google;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.SynthesisAdapter;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * {@code text:synthesize}. Input is limited to 5,000 characters.
 */
public class GoogleSynthesisAdapter extends AbstractHttpAdapter implements SynthesisAdapter {

    private static final int MAX_INPUT_CHARACTERS = 5000;

    private static final Map<String, String> MIME_TYPES = Map.of(
            "LINEAR16", "audio/wav",
            "MP3", "audio/mpeg",
            "OGG_OPUS", "audio/ogg"
    );

    public GoogleSynthesisAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.SynthesisResult> synthesize(VoiceModels.SynthesisRequest request) {
        String encoding = descriptor.parameter("audio_encoding", "LINEAR16");

        Map<String, Object> voice = new HashMap<>();
        voice.put("languageCode", descriptor.parameter("language_code", "en-US"));
        voice.put("ssmlGender", descriptor.parameter("ssml_gender", "NEUTRAL"));
        String voiceName = request.getVoiceHint() != null ? request.getVoiceHint() : descriptor.parameter("voice", null);
        if (voiceName != null) {
            voice.put("name", voiceName);
        }

        Map<String, Object> body = Map.of(
                "input", Map.of("text", request.getText()),
                "voice", voice,
                "audioConfig", Map.of(
                        "audioEncoding", encoding,
                        "speakingRate", descriptor.doubleParameter("speed", 1.0)));

        return execute("synthesize", webClient.post()
                .uri("/v1/text:synthesize")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(SynthesizeResponse.class)
                .map(response -> VoiceModels.SynthesisResult.builder()
                        .audio(requireAudio(response.getAudioContent()))
                        .mimeType(MIME_TYPES.getOrDefault(encoding, "application/octet-stream"))
                        .build()));
    }

    @Data
    @NoArgsConstructor
    public static class SynthesizeResponse {
        // base64 in the JSON body, decoded by Jackson
        private byte[] audioContent;
    }
}
