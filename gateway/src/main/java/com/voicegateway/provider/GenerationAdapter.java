package com.voicegateway.provider;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import reactor.core.publisher.Mono;

public interface GenerationAdapter extends ProviderAdapter {

    Mono<VoiceModels.GenerationResult> generate(VoiceModels.GenerationRequest request);

    @Override
    default CapabilityKind getCapability() {
        return CapabilityKind.GENERATION;
    }
}
