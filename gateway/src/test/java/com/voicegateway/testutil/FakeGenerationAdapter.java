package com.voicegateway.testutil;

import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.GenerationAdapter;
import reactor.core.publisher.Mono;

public class FakeGenerationAdapter extends FakeAdapter<VoiceModels.GenerationRequest, VoiceModels.GenerationResult>
        implements GenerationAdapter {

    public FakeGenerationAdapter(String name, String reply) {
        super(name, request -> Mono.just(VoiceModels.GenerationResult.builder().responseText(reply).build()));
    }

    @Override
    public CapabilityKind getCapability() {
        return CapabilityKind.GENERATION;
    }

    @Override
    public Mono<VoiceModels.GenerationResult> generate(VoiceModels.GenerationRequest request) {
        return next(request);
    }

    public void replyNext(String reply) {
        enqueue(request -> Mono.just(VoiceModels.GenerationResult.builder().responseText(reply).build()));
    }
}
