package com.voicegateway.config;

import com.voicegateway.model.CapabilityKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "voice-gateway")
public class GatewayProperties {

    /**
     * Boot-time seed, applied as one configuration update. Keyed by capability name.
     */
    private Map<String, CapabilitySeed> capabilities = new LinkedHashMap<>();
    private RoutingSettings routing = new RoutingSettings();
    private RateLimitSettings rateLimit = new RateLimitSettings();
    private CacheSettings cache = new CacheSettings();

    @Data
    public static class CapabilitySeed {
        private String provider;
        private Map<String, ProviderSettings> providers = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderSettings {
        private Map<String, String> credentials = new LinkedHashMap<>();
        private Map<String, String> parameters = new LinkedHashMap<>();
    }

    @Data
    public static class RoutingSettings {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Map<CapabilityKind, Duration> timeouts = new EnumMap<>(CapabilityKind.class);
        private Duration retryBackoff = Duration.ofMillis(500);
        private int historyLimit = 10;
        private int maxContextEntries = 32;

        public Duration timeoutFor(CapabilityKind kind) {
            Duration timeout = timeouts.get(kind);
            return timeout != null ? timeout : defaultTimeout;
        }
    }

    @Data
    public static class RateLimitSettings {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
    }

    @Data
    public static class CacheSettings {
        private boolean enabled = false;
        private int ttlSeconds = 3600;
    }
}
