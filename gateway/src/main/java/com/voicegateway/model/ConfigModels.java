package com.voicegateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial configuration updates and the management API payloads around them.
 */
public class ConfigModels {

    /**
     * Names only the fields to change. Capability keys stay strings here so that an unknown
     * name is reported as a validation failure on that field instead of a parse error.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConfigUpdate {
        @JsonProperty("expected_version")
        private Long expectedVersion;

        @Builder.Default
        private Map<String, CapabilityUpdate> capabilities = new LinkedHashMap<>();

        public static ConfigUpdate of(CapabilityKind kind, CapabilityUpdate update) {
            Map<String, CapabilityUpdate> changes = new LinkedHashMap<>();
            changes.put(kind.key(), update);
            return ConfigUpdate.builder().capabilities(changes).build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CapabilityUpdate {
        // absent: keep the current provider
        private String provider;

        private Map<String, String> credentials;

        private Map<String, String> parameters;
    }

    /**
     * Body of POST /api/config: either the structured form or the flat dot-notation
     * {@code config} map sent by the management app.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConfigUpdateRequest {
        @JsonProperty("expected_version")
        private Long expectedVersion;

        private Map<String, CapabilityUpdate> capabilities;

        private Map<String, Object> config;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConfigUpdateResponse {
        private String status;
        private String message;
        private long version;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StatusResponse {
        private String status;
        private long version;
        private Map<String, String> providers;
        private Map<String, CapabilityHealth> health;
    }
}
