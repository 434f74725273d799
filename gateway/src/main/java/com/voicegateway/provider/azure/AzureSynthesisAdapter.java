package com.voicegateway.provider.azure;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.SynthesisAdapter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * SSML synthesis returning 16 kHz mono WAV. Input is limited to 5,000 characters.
 */
public class AzureSynthesisAdapter extends AbstractHttpAdapter implements SynthesisAdapter {

    static final String DEFAULT_VOICE = "en-US-JennyNeural";
    static final String OUTPUT_FORMAT = "riff-16khz-16bit-mono-pcm";
    private static final int MAX_INPUT_CHARACTERS = 5000;

    public AzureSynthesisAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.SynthesisResult> synthesize(VoiceModels.SynthesisRequest request) {
        String voice = request.getVoiceHint() != null ? request.getVoiceHint() : descriptor.parameter("voice", DEFAULT_VOICE);
        String ssml = ssml(request.getText(), voice, descriptor.parameter("language", "en-US"));

        return execute("synthesize", webClient.post()
                .uri("/cognitiveservices/v1")
                .header(HttpHeaders.CONTENT_TYPE, "application/ssml+xml")
                .header("X-Microsoft-OutputFormat", OUTPUT_FORMAT)
                .header(HttpHeaders.USER_AGENT, "voice-gateway")
                .bodyValue(ssml.getBytes(StandardCharsets.UTF_8))
                .retrieve()
                .bodyToMono(byte[].class)
                .map(audio -> VoiceModels.SynthesisResult.builder()
                        .audio(requireAudio(audio))
                        .mimeType("audio/wav")
                        .build()));
    }

    static String ssml(String text, String voice, String language) {
        return "<speak version='1.0' xml:lang='" + HtmlUtils.htmlEscape(language, "UTF-8") + "'>"
                + "<voice name='" + HtmlUtils.htmlEscape(voice, "UTF-8") + "'>"
                + HtmlUtils.htmlEscape(text, "UTF-8")
                + "</voice></speak>";
    }
}
