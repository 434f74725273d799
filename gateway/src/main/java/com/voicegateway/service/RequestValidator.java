package com.voicegateway.service;

import com.voicegateway.config.GatewayProperties;
import com.voicegateway.exception.RequestValidationException;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AudioFormats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shape checks applied before any adapter is resolved. Returns normalized copies; the
 * caller's request objects are never modified.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private static final Set<String> ROLES = Set.of(VoiceModels.ConversationTurn.USER, VoiceModels.ConversationTurn.ASSISTANT);

    private final GatewayProperties properties;

    public VoiceModels.TranscriptionRequest validate(VoiceModels.TranscriptionRequest request) {
        if (request == null) {
            throw new RequestValidationException("request body is required");
        }
        if (request.getAudio() == null || request.getAudio().length == 0) {
            throw new RequestValidationException("audio must not be empty");
        }
        return request.toBuilder()
                .encodingHint(AudioFormats.normalizeHint(request.getEncodingHint()))
                .build();
    }

    public VoiceModels.SynthesisRequest validate(VoiceModels.SynthesisRequest request) {
        if (request == null) {
            throw new RequestValidationException("request body is required");
        }
        if (request.getText() == null || request.getText().isBlank()) {
            throw new RequestValidationException("text must not be blank");
        }
        String voice = request.getVoiceHint();
        return request.toBuilder()
                .voiceHint(voice == null || voice.isBlank() ? null : voice.trim())
                .build();
    }

    /**
     * Also bounds the context and keeps only the most recent history turns, dropping the
     * oldest first.
     */
    public VoiceModels.GenerationRequest validate(VoiceModels.GenerationRequest request) {
        if (request == null) {
            throw new RequestValidationException("request body is required");
        }
        if (request.getUserInput() == null || request.getUserInput().isBlank()) {
            throw new RequestValidationException("user_input must not be blank");
        }

        Map<String, String> context = request.getContext() == null ? Map.of() : request.getContext();
        int maxContext = properties.getRouting().getMaxContextEntries();
        if (context.size() > maxContext) {
            throw new RequestValidationException("context has " + context.size()
                    + " entries, at most " + maxContext + " are allowed");
        }
        for (String key : context.keySet()) {
            if (key == null || key.isBlank()) {
                throw new RequestValidationException("context keys must not be blank");
            }
        }

        List<VoiceModels.ConversationTurn> history = request.getHistory() == null ? List.of() : request.getHistory();
        for (int i = 0; i < history.size(); i++) {
            VoiceModels.ConversationTurn turn = history.get(i);
            if (turn == null || turn.getRole() == null || !ROLES.contains(turn.getRole())) {
                throw new RequestValidationException("history[" + i + "].role must be one of " + ROLES);
            }
            if (turn.getContent() == null) {
                throw new RequestValidationException("history[" + i + "].content is required");
            }
        }
        int limit = Math.max(0, properties.getRouting().getHistoryLimit());
        List<VoiceModels.ConversationTurn> recent = history.size() > limit
                ? history.subList(history.size() - limit, history.size())
                : history;

        return request.toBuilder()
                .context(new LinkedHashMap<>(context))
                .history(List.copyOf(new ArrayList<>(recent)))
                .build();
    }
}
