package com.voicegateway.provider.google;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.AudioFormats;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.TranscriptionAdapter;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Synchronous {@code speech:recognize}. Inline audio is capped at 10 MB.
 */
public class GoogleTranscriptionAdapter extends AbstractHttpAdapter implements TranscriptionAdapter {

    private static final long MAX_AUDIO_BYTES = 10L * 1024 * 1024;

    private static final Map<String, String> ENCODINGS = Map.of(
            "wav", "LINEAR16",
            "pcm", "LINEAR16",
            "flac", "FLAC",
            "ogg", "OGG_OPUS",
            "opus", "OGG_OPUS",
            "mp3", "MP3",
            "webm", "WEBM_OPUS"
    );

    public GoogleTranscriptionAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.bytes(MAX_AUDIO_BYTES));
    }

    @Override
    public Mono<VoiceModels.TranscriptionResult> transcribe(VoiceModels.TranscriptionRequest request) {
        String format = AudioFormats.normalizeHint(request.getEncodingHint());
        String languageCode = descriptor.parameter("language_code", "en-US");

        Map<String, Object> body = Map.of(
                "config", Map.of(
                        "encoding", ENCODINGS.getOrDefault(format, "ENCODING_UNSPECIFIED"),
                        "sampleRateHertz", descriptor.intParameter("sample_rate", 16000),
                        "languageCode", languageCode),
                "audio", Map.of("content", Base64.getEncoder().encodeToString(request.getAudio())));

        return execute("recognize", webClient.post()
                .uri("/v1/speech:recognize")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(RecognizeResponse.class)
                .map(response -> toResult(response, languageCode)));
    }

    // no results means no speech was recognized, which is an empty transcript rather than an error
    private VoiceModels.TranscriptionResult toResult(RecognizeResponse response, String requestedLanguage) {
        List<RecognizeResponse.Result> results = response.getResults() == null ? List.of() : response.getResults();
        String text = results.stream()
                .filter(r -> r.getAlternatives() != null && !r.getAlternatives().isEmpty())
                .map(r -> r.getAlternatives().get(0).getTranscript())
                .filter(Objects::nonNull)
                .map(String::trim)
                .collect(Collectors.joining(" "));
        String language = results.stream()
                .map(RecognizeResponse.Result::getLanguageCode)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(requestedLanguage);
        return VoiceModels.TranscriptionResult.builder()
                .text(text)
                .languageHint(language)
                .build();
    }

    @Data
    @NoArgsConstructor
    public static class RecognizeResponse {
        private List<Result> results;

        @Data
        @NoArgsConstructor
        public static class Result {
            private List<Alternative> alternatives;
            private String languageCode;
        }

        @Data
        @NoArgsConstructor
        public static class Alternative {
            private String transcript;
            private Double confidence;
        }
    }
}
