package com.voicegateway.provider.anthropic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.AbstractHttpAdapter;
import com.voicegateway.provider.GenerationAdapter;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.PromptSupport;
import com.voicegateway.provider.UpstreamErrors;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Messages API. Accepts up to 16,000 characters of user input.
 */
@Slf4j
public class AnthropicGenerationAdapter extends AbstractHttpAdapter implements GenerationAdapter {

    static final String DEFAULT_MODEL = "claude-3-sonnet-20240229";
    private static final int MAX_INPUT_CHARACTERS = 16_000;

    public AnthropicGenerationAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.GenerationResult> generate(VoiceModels.GenerationRequest request) {
        String model = descriptor.parameter("model", DEFAULT_MODEL);
        log.debug("Anthropic messages request: model={}", model);

        return execute("messages", webClient.post()
                .uri("/messages")
                .bodyValue(toMessagesRequest(request, model))
                .retrieve()
                .bodyToMono(MessagesResponse.class)
                .map(this::toResult));
    }

    MessagesRequest toMessagesRequest(VoiceModels.GenerationRequest request, String model) {
        MessagesRequest messagesRequest = new MessagesRequest();
        messagesRequest.setModel(model);
        messagesRequest.setMaxTokens(descriptor.intParameter("max_tokens", 150));
        messagesRequest.setTemperature(descriptor.doubleParameter("temperature", 0.7));

        String context = PromptSupport.contextLine(request.getContext());
        String system = PromptSupport.systemPrompt(descriptor);
        messagesRequest.setSystem(context != null ? system + "\n\n" + context : system);

        // the conversation has to open with a user turn
        List<MessagesRequest.Message> messages = new ArrayList<>();
        for (VoiceModels.ConversationTurn turn : request.getHistory()) {
            if (messages.isEmpty() && !VoiceModels.ConversationTurn.USER.equals(turn.getRole())) {
                continue;
            }
            messages.add(new MessagesRequest.Message(turn.getRole(), turn.getContent()));
        }
        messages.add(new MessagesRequest.Message(VoiceModels.ConversationTurn.USER, request.getUserInput()));
        messagesRequest.setMessages(messages);
        return messagesRequest;
    }

    private VoiceModels.GenerationResult toResult(MessagesResponse response) {
        if (response.getContent() == null || response.getContent().isEmpty()) {
            throw UpstreamErrors.malformed(getName(), "no content blocks in response");
        }
        String text = response.getContent().stream()
                .filter(block -> "text".equals(block.getType()) && block.getText() != null)
                .map(MessagesResponse.ContentBlock::getText)
                .collect(Collectors.joining());
        return VoiceModels.GenerationResult.builder()
                .responseText(text.trim())
                .build();
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MessagesRequest {
        private String model;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        private String system;
        private List<Message> messages;
        private Double temperature;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Message {
            private String role;
            private String content;
        }
    }

    @Data
    @NoArgsConstructor
    public static class MessagesResponse {
        private String id;
        private List<ContentBlock> content;

        @JsonProperty("stop_reason")
        private String stopReason;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class ContentBlock {
            private String type;
            private String text;
        }
    }
}
