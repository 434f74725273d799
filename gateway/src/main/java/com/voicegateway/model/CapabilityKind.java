package com.voicegateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The three operations the gateway exposes. Fixed set.
 */
public enum CapabilityKind {

    TRANSCRIPTION("transcription", "stt"),
    SYNTHESIS("synthesis", "tts"),
    GENERATION("generation", "llm");

    private final String key;
    private final String legacyPrefix;

    CapabilityKind(String key, String legacyPrefix) {
        this.key = key;
        this.legacyPrefix = legacyPrefix;
    }

    /**
     * Name used in JSON payloads and configuration keys
     */
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Prefix used by the flat dot-notation config of the management app
     */
    public String legacyPrefix() {
        return legacyPrefix;
    }

    /**
     * Accepts the JSON key, the enum name or the legacy prefix, case-insensitively
     */
    public static Optional<CapabilityKind> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.key.equals(normalized)
                        || k.legacyPrefix.equals(normalized)
                        || k.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static CapabilityKind fromJson(String value) {
        return lookup(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + value));
    }
}
