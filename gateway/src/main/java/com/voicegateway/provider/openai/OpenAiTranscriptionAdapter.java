package com.voicegateway.provider.openai;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.AudioFormats;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.TranscriptionAdapter;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Whisper transcription. The upload limit is 25 MB of audio.
 */
public class OpenAiTranscriptionAdapter extends AbstractHttpAdapter implements TranscriptionAdapter {

    static final String DEFAULT_MODEL = "whisper-1";
    private static final long MAX_AUDIO_BYTES = 25L * 1024 * 1024;

    public OpenAiTranscriptionAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.bytes(MAX_AUDIO_BYTES));
    }

    @Override
    public Mono<VoiceModels.TranscriptionResult> transcribe(VoiceModels.TranscriptionRequest request) {
        String format = AudioFormats.normalizeHint(request.getEncodingHint());
        String language = descriptor.parameter("language", null);

        MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("file", request.getAudio())
                .filename("audio." + format)
                .contentType(MediaType.parseMediaType(AudioFormats.mimeType(format)));
        multipart.part("model", descriptor.parameter("model", DEFAULT_MODEL));
        if (language != null) {
            multipart.part("language", language);
        }

        return execute("transcribe", webClient.post()
                .uri("/audio/transcriptions")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart.build()))
                .retrieve()
                .bodyToMono(TranscriptionResponse.class)
                .map(response -> VoiceModels.TranscriptionResult.builder()
                        .text(requireText(response.getText(), "text").trim())
                        .languageHint(response.getLanguage() != null ? response.getLanguage() : language)
                        .build()));
    }

    @Data
    @NoArgsConstructor
    public static class TranscriptionResponse {
        private String text;
        private String language;
    }
}
