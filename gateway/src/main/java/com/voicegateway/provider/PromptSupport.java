package com.voicegateway.provider;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prompt assembly shared by the generation adapters.
 */
public final class PromptSupport {

    public static final String SYSTEM_PROMPT = "system_prompt";
    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are a helpful personal assistant robot. Keep responses concise and friendly.";

    private PromptSupport() {
    }

    public static String systemPrompt(AdapterDescriptor descriptor) {
        return descriptor.parameter(SYSTEM_PROMPT, DEFAULT_SYSTEM_PROMPT);
    }

    /**
     * Renders the ordered context as a single line, or {@code null} when there is none
     */
    public static String contextLine(Map<String, String> context) {
        if (context == null || context.isEmpty()) {
            return null;
        }
        return context.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; ", "Context: ", ""));
    }

    /**
     * Single-string prompt for completion-style APIs
     */
    public static String completionPrompt(AdapterDescriptor descriptor, VoiceModels.GenerationRequest request) {
        StringBuilder prompt = new StringBuilder(systemPrompt(descriptor)).append("\n\n");
        String context = contextLine(request.getContext());
        if (context != null) {
            prompt.append(context).append("\n\n");
        }
        if (request.getHistory() != null) {
            for (VoiceModels.ConversationTurn turn : request.getHistory()) {
                prompt.append(VoiceModels.ConversationTurn.ASSISTANT.equals(turn.getRole()) ? "Assistant: " : "User: ")
                        .append(turn.getContent())
                        .append("\n\n");
            }
        }
        return prompt.append("User: ").append(request.getUserInput()).append("\n\nAssistant:").toString();
    }
}
