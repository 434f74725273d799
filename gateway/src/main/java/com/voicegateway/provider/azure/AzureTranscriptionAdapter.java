package com.voicegateway.provider.azure;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.voicegateway.exception.ErrorKind;
import com.voicegateway.exception.UpstreamException;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.AudioFormats;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.TranscriptionAdapter;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Short-audio REST recognition. The service accepts at most 60 seconds of audio, about
 * 2 MB of 16 kHz 16-bit mono PCM.
 */
public class AzureTranscriptionAdapter extends AbstractHttpAdapter implements TranscriptionAdapter {

    private static final long MAX_AUDIO_BYTES = 2L * 1024 * 1024;

    // statuses meaning "heard nothing", as opposed to a service-side error
    private static final Set<String> NO_SPEECH = Set.of("NoMatch", "InitialSilenceTimeout", "BabbleTimeout");

    public AzureTranscriptionAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.bytes(MAX_AUDIO_BYTES));
    }

    @Override
    public Mono<VoiceModels.TranscriptionResult> transcribe(VoiceModels.TranscriptionRequest request) {
        String language = descriptor.parameter("language", "en-US");
        String format = AudioFormats.normalizeHint(request.getEncodingHint());

        return execute("recognize", webClient.post()
                .uri(uri -> uri.path("/speech/recognition/conversation/cognitiveservices/v1")
                        .queryParam("language", language)
                        .queryParam("format", "simple")
                        .build())
                .header(HttpHeaders.CONTENT_TYPE, contentType(format))
                .bodyValue(request.getAudio())
                .retrieve()
                .bodyToMono(RecognitionResponse.class)
                .map(response -> toResult(response, language)));
    }

    private String contentType(String format) {
        if ("ogg".equals(format) || "opus".equals(format)) {
            return "audio/ogg; codecs=opus";
        }
        return "audio/wav; codecs=audio/pcm; samplerate=" + descriptor.intParameter("sample_rate", 16000);
    }

    private VoiceModels.TranscriptionResult toResult(RecognitionResponse response, String language) {
        String status = requireText(response.getRecognitionStatus(), "RecognitionStatus");
        if ("Success".equals(status)) {
            return VoiceModels.TranscriptionResult.builder()
                    .text(requireText(response.getDisplayText(), "DisplayText").trim())
                    .languageHint(language)
                    .build();
        }
        if (NO_SPEECH.contains(status)) {
            return VoiceModels.TranscriptionResult.builder()
                    .text("")
                    .languageHint(language)
                    .build();
        }
        throw new UpstreamException(ErrorKind.UPSTREAM_REJECTED, getName(), "RecognitionStatus " + status);
    }

    @Data
    @NoArgsConstructor
    public static class RecognitionResponse {
        @JsonProperty("RecognitionStatus")
        private String recognitionStatus;

        @JsonProperty("DisplayText")
        private String displayText;

        @JsonProperty("Offset")
        private Long offset;

        @JsonProperty("Duration")
        private Long duration;
    }
}
