package com.voicegateway.provider;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import reactor.core.publisher.Mono;

public interface SynthesisAdapter extends ProviderAdapter {

    Mono<VoiceModels.SynthesisResult> synthesize(VoiceModels.SynthesisRequest request);

    @Override
    default CapabilityKind getCapability() {
        return CapabilityKind.SYNTHESIS;
    }
}
