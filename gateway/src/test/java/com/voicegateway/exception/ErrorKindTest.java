package com.voicegateway.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @Test
    void shouldRetryOnlyTransientTransportFailures() {
        assertThat(Arrays.stream(ErrorKind.values()).filter(ErrorKind::isRetryable))
                .containsExactlyInAnyOrder(ErrorKind.UPSTREAM_TIMEOUT, ErrorKind.NETWORK_UNAVAILABLE);
    }

    @Test
    void shouldMapKindsToHttpStatus() {
        assertThat(ErrorKind.REQUEST_VALIDATION_FAILED.status()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorKind.CONFIG_VALIDATION_FAILED.status()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorKind.CONFIG_CONFLICT.status()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ErrorKind.QUOTA_EXCEEDED.status()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(ErrorKind.UPSTREAM_TIMEOUT.status()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(ErrorKind.NETWORK_UNAVAILABLE.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(ErrorKind.INVALID_CREDENTIALS.status()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void shouldSeparateUpstreamKinds() {
        assertThat(Arrays.stream(ErrorKind.values()).filter(ErrorKind::isUpstream)).hasSize(6);
        assertThat(ErrorKind.CONFIG_CONFLICT.isUpstream()).isFalse();
        assertThat(ErrorKind.REQUEST_VALIDATION_FAILED.isUpstream()).isFalse();
    }

    @Test
    void shouldExposeConflictVersions() {
        ConfigConflictException conflict = new ConfigConflictException(4, 5);

        assertThat(conflict.getKind()).isEqualTo(ErrorKind.CONFIG_CONFLICT);
        assertThat(conflict.getMessage()).contains("4").contains("5");
    }
}
