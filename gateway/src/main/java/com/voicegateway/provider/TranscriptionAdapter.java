package com.voicegateway.provider;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import reactor.core.publisher.Mono;

public interface TranscriptionAdapter extends ProviderAdapter {

    Mono<VoiceModels.TranscriptionResult> transcribe(VoiceModels.TranscriptionRequest request);

    @Override
    default CapabilityKind getCapability() {
        return CapabilityKind.TRANSCRIPTION;
    }
}
