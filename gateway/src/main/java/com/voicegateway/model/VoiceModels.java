package com.voicegateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, vendor-neutral request and result shapes for the three capabilities.
 */
public class VoiceModels {

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TranscriptionRequest {
        private byte[] audio;

        // wav, flac, ogg, mp3, webm
        @Builder.Default
        private String encodingHint = "wav";
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TranscriptionResult {
        private String text;

        @JsonProperty("language")
        private String languageHint;

        private GatewayMetadata gateway;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SynthesisRequest {
        @NotBlank(message = "Text field is required")
        private String text;

        @JsonProperty("voice")
        private String voiceHint;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SynthesisResult {
        private byte[] audio;
        private String mimeType;

        @JsonIgnore
        private GatewayMetadata gateway;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerationRequest {
        @NotBlank(message = "user_input is required")
        @JsonProperty("user_input")
        private String userInput;

        @Builder.Default
        private Map<String, String> context = new LinkedHashMap<>();

        @Builder.Default
        private List<ConversationTurn> history = List.of();
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerationResult {
        @JsonProperty("response")
        private String responseText;

        private GatewayMetadata gateway;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConversationTurn {
        public static final String USER = "user";
        public static final String ASSISTANT = "assistant";

        private String role;
        private String content;

        public static ConversationTurn user(String content) {
            return new ConversationTurn(USER, content);
        }

        public static ConversationTurn assistant(String content) {
            return new ConversationTurn(ASSISTANT, content);
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GatewayMetadata {
        private String provider;

        @JsonProperty("request_id")
        private String requestId;

        @JsonProperty("latency_ms")
        private Long latencyMs;

        private Integer attempts;

        private Boolean truncated;

        // settings of the adapter that served the request, used to key cached audio
        @JsonIgnore
        private String settingsKey;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Error error;

        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public static class Error {
            private String message;
            private String type;
            private String code;
            private String field;

            @JsonProperty("attempted_version")
            private Long attemptedVersion;

            @JsonProperty("current_version")
            private Long currentVersion;

            private String diagnostic;
        }
    }
}
