package com.voicegateway.service;

import com.voicegateway.config.GatewayProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitService {

    static final String ANONYMOUS = "anonymous";

    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        if (properties.getRateLimit().isEnabled()) {
            log.info("Rate limiting enabled: {} requests/minute per client", properties.getRateLimit().getRequestsPerMinute());
        } else {
            log.info("Rate limiting disabled");
        }
    }

    /**
     * Takes one token from the client's bucket.
     *
     * @return seconds until a token is available, or 0 if the request may proceed
     */
    public long tryConsume(String identifier) {
        if (!properties.getRateLimit().isEnabled()) {
            return 0;
        }

        ConsumptionProbe consumption = bucketFor(identifier).tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            meterRegistry.counter("voice.ratelimit", "status", "allowed").increment();
            return 0;
        }
        meterRegistry.counter("voice.ratelimit", "status", "exceeded").increment();
        log.warn("Rate limit exceeded for client: {}", key(identifier));
        return Math.max(1, TimeUnit.NANOSECONDS.toSeconds(consumption.getNanosToWaitForRefill()));
    }

    public RateLimitInfo getRateLimitInfo(String identifier) {
        int limit = properties.getRateLimit().getRequestsPerMinute();
        if (!properties.getRateLimit().isEnabled()) {
            return new RateLimitInfo(Integer.MAX_VALUE, Integer.MAX_VALUE, 0);
        }
        Bucket bucket = buckets.get(key(identifier));
        int remaining = bucket != null ? (int) bucket.getAvailableTokens() : limit;
        return new RateLimitInfo(limit, remaining, 60);
    }

    /**
     * Drops the client's bucket; the next request starts with a full one
     */
    public void resetLimit(String identifier) {
        buckets.remove(key(identifier));
        log.info("Rate limit reset for client: {}", key(identifier));
    }

    private Bucket bucketFor(String identifier) {
        return buckets.computeIfAbsent(key(identifier),
                k -> createBucket(properties.getRateLimit().getRequestsPerMinute()));
    }

    private static String key(String identifier) {
        return identifier == null || identifier.isBlank() ? ANONYMOUS : identifier;
    }

    private Bucket createBucket(int requestsPerMinute) {
        Bandwidth limit = Bandwidth.classic(
                requestsPerMinute,
                Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))
        );
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    public record RateLimitInfo(int limit, int remaining, int resetSeconds) {}
}
