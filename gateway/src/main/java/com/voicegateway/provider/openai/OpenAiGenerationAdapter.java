package com.voicegateway.provider.openai;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions. Accepts up to 16,000 characters of user input.
 */
@Slf4j
public class OpenAiGenerationAdapter extends AbstractHttpAdapter implements GenerationAdapter {

    static final String DEFAULT_MODEL = "gpt-3.5-turbo";
    private static final int MAX_INPUT_CHARACTERS = 16_000;

    public OpenAiGenerationAdapter(WebClient webClient, AdapterDescriptor descriptor) {
        super(descriptor, webClient, PayloadLimit.characters(MAX_INPUT_CHARACTERS));
    }

    @Override
    public Mono<VoiceModels.GenerationResult> generate(VoiceModels.GenerationRequest request) {
        String model = descriptor.parameter("model", DEFAULT_MODEL);
        log.debug("OpenAI chat request: model={}, historyTurns={}", model, request.getHistory().size());

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", buildMessages(request));
        body.put("max_tokens", descriptor.intParameter("max_tokens", 150));
        body.put("temperature", descriptor.doubleParameter("temperature", 0.7));

        return execute("chat", webClient.post()
                .uri("/chat/completions")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ChatCompletion.class)
                .map(this::toResult));
    }

    private List<Message> buildMessages(VoiceModels.GenerationRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(new Message("system", PromptSupport.systemPrompt(descriptor)));
        String context = PromptSupport.contextLine(request.getContext());
        if (context != null) {
            messages.add(new Message("system", context));
        }
        for (VoiceModels.ConversationTurn turn : request.getHistory()) {
            messages.add(new Message(turn.getRole(), turn.getContent()));
        }
        messages.add(new Message(VoiceModels.ConversationTurn.USER, request.getUserInput()));
        return messages;
    }

    private VoiceModels.GenerationResult toResult(ChatCompletion completion) {
        if (completion.getChoices() == null || completion.getChoices().isEmpty()
                || completion.getChoices().get(0).getMessage() == null) {
            throw UpstreamErrors.malformed(getName(), "no choices in completion");
        }
        String content = requireText(completion.getChoices().get(0).getMessage().getContent(), "choices[0].message.content");
        return VoiceModels.GenerationResult.builder()
                .responseText(content.trim())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;
        private String content;
    }

    @Data
    @NoArgsConstructor
    public static class ChatCompletion {
        private String id;
        private List<Choice> choices;

        @Data
        @NoArgsConstructor
        public static class Choice {
            private Integer index;
            private Message message;
        }
    }
}
