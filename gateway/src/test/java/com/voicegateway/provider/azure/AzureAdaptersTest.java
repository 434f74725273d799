package com.voicegateway.provider.azure;

import com.voicegateway.exception.ErrorKind;
import com.voicegateway.exception.UpstreamException;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.SynthesisAdapter;
import com.voicegateway.provider.TranscriptionAdapter;
import com.voicegateway.testutil.StubExchange;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AzureAdaptersTest {

    private final AzureAdapters adapters = new AzureAdapters();

    private static AdapterDescriptor descriptor(CapabilityKind kind) {
        return AdapterDescriptor.builder()
                .capability(kind)
                .providerName("azure")
                .credentials(Map.of("speech_key", "az-key", "region", "westeurope"))
                .build();
    }

    private TranscriptionAdapter transcription(StubExchange stub) {
        return (TranscriptionAdapter) adapters.azureTranscriptionFactory(stub.builder())
                .create(descriptor(CapabilityKind.TRANSCRIPTION));
    }

    private static VoiceModels.TranscriptionRequest wav() {
        return VoiceModels.TranscriptionRequest.builder().audio(new byte[]{1, 2}).encodingHint("wav").build();
    }

    @Test
    void shouldCallRegionalEndpointWithSubscriptionKey() {
        StubExchange stub = StubExchange.json(HttpStatus.OK,
                "{\"RecognitionStatus\":\"Success\",\"DisplayText\":\"Good morning.\",\"Offset\":0,\"Duration\":100}");

        StepVerifier.create(transcription(stub).transcribe(wav()))
                .assertNext(result -> assertThat(result.getText()).isEqualTo("Good morning."))
                .verifyComplete();

        assertThat(stub.lastRequest().url().getHost()).isEqualTo("westeurope.stt.speech.microsoft.com");
        assertThat(stub.lastRequest().url().getQuery()).contains("language=en-US").contains("format=simple");
        assertThat(stub.lastRequest().headers().getFirst("Ocp-Apim-Subscription-Key")).isEqualTo("az-key");
    }

    @Test
    void shouldTreatNoMatchAsEmptyTranscript() {
        StubExchange stub = StubExchange.json(HttpStatus.OK, "{\"RecognitionStatus\":\"NoMatch\"}");

        StepVerifier.create(transcription(stub).transcribe(wav()))
                .assertNext(result -> assertThat(result.getText()).isEmpty())
                .verifyComplete();
    }

    @Test
    void shouldRejectOtherRecognitionStatuses() {
        StubExchange stub = StubExchange.json(HttpStatus.OK, "{\"RecognitionStatus\":\"Error\"}");

        StepVerifier.create(transcription(stub).transcribe(wav()))
                .expectErrorSatisfies(error -> {
                    assertThat(((UpstreamException) error).getKind()).isEqualTo(ErrorKind.UPSTREAM_REJECTED);
                    assertThat(((UpstreamException) error).getDiagnostic()).contains("Error");
                })
                .verify();
    }

    @Test
    void shouldSynthesizeWavFromSsml() {
        byte[] audio = {82, 73, 70, 70};
        StubExchange stub = StubExchange.audio("audio/wav", audio);
        SynthesisAdapter adapter = (SynthesisAdapter) adapters.azureSynthesisFactory(stub.builder())
                .create(descriptor(CapabilityKind.SYNTHESIS));

        StepVerifier.create(adapter.synthesize(VoiceModels.SynthesisRequest.builder().text("Hello").build()))
                .assertNext(result -> {
                    assertThat(result.getAudio()).isEqualTo(audio);
                    assertThat(result.getMimeType()).isEqualTo("audio/wav");
                })
                .verifyComplete();

        assertThat(stub.lastRequest().url().toString())
                .isEqualTo("https://westeurope.tts.speech.microsoft.com/cognitiveservices/v1");
        assertThat(stub.lastRequest().headers().getFirst("X-Microsoft-OutputFormat"))
                .isEqualTo("riff-16khz-16bit-mono-pcm");
    }

    @Test
    void shouldEscapeMarkupInSsml() {
        String ssml = AzureSynthesisAdapter.ssml("Tom & Jerry <3", "en-US-GuyNeural", "en-US");

        assertThat(ssml).isEqualTo("<speak version='1.0' xml:lang='en-US'>"
                + "<voice name='en-US-GuyNeural'>Tom &amp; Jerry &lt;3</voice></speak>");
    }
}
