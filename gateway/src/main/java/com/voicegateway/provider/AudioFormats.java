package com.voicegateway.provider;

import java.util.Locale;
import java.util.Map;

public final class AudioFormats {

    private static final Map<String, String> MIME_TYPES = Map.of(
            "wav", "audio/wav",
            "mp3", "audio/mpeg",
            "opus", "audio/opus",
            "ogg", "audio/ogg",
            "aac", "audio/aac",
            "flac", "audio/flac",
            "pcm", "audio/pcm",
            "webm", "audio/webm"
    );

    private AudioFormats() {
    }

    public static String mimeType(String format) {
        if (format == null) {
            return "application/octet-stream";
        }
        return MIME_TYPES.getOrDefault(format.toLowerCase(Locale.ROOT), "application/octet-stream");
    }

    public static String normalizeHint(String encodingHint) {
        return encodingHint == null || encodingHint.isBlank() ? "wav" : encodingHint.trim().toLowerCase(Locale.ROOT);
    }
}
