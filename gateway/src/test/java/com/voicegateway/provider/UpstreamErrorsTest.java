package com.voicegateway.provider;

import com.voicegateway.exception.ErrorKind;
import com.voicegateway.exception.UpstreamException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.junit.jupiter.api.Test;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamErrorsTest {

    private static WebClientResponseException status(int code, String body) {
        return WebClientResponseException.create(code, "status " + code, HttpHeaders.EMPTY,
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    private static WebClientRequestException requestFailure(Throwable cause) {
        return new WebClientRequestException(cause, HttpMethod.POST, URI.create("https://api.example.com"), HttpHeaders.EMPTY);
    }

    @Test
    void shouldMapHttpStatusToErrorKind() {
        assertThat(UpstreamErrors.translate("openai", status(401, "bad key")).getKind()).isEqualTo(ErrorKind.INVALID_CREDENTIALS);
        assertThat(UpstreamErrors.translate("openai", status(403, "")).getKind()).isEqualTo(ErrorKind.INVALID_CREDENTIALS);
        assertThat(UpstreamErrors.translate("openai", status(429, "")).getKind()).isEqualTo(ErrorKind.QUOTA_EXCEEDED);
        assertThat(UpstreamErrors.translate("openai", status(504, "")).getKind()).isEqualTo(ErrorKind.UPSTREAM_TIMEOUT);
        assertThat(UpstreamErrors.translate("openai", status(400, "")).getKind()).isEqualTo(ErrorKind.UPSTREAM_REJECTED);
        assertThat(UpstreamErrors.translate("openai", status(503, "")).getKind()).isEqualTo(ErrorKind.UPSTREAM_REJECTED);
    }

    @Test
    void shouldCarryVendorBodyAsDiagnostic() {
        UpstreamException error = UpstreamErrors.translate("anthropic", status(401, "{\"error\": \"invalid x-api-key\"}"));

        assertThat(error.getProviderName()).isEqualTo("anthropic");
        assertThat(error.getDiagnostic()).isEqualTo("HTTP 401: {\"error\": \"invalid x-api-key\"}");
        assertThat(error.getMessage()).isEqualTo("Provider anthropic failed: invalid_credentials");
    }

    @Test
    void shouldCapLongDiagnostics() {
        UpstreamException error = UpstreamErrors.translate("google", status(500, "x".repeat(1000)));

        assertThat(error.getDiagnostic()).hasSize(303).endsWith("...");
    }

    @Test
    void shouldMapTransportFailures() {
        assertThat(UpstreamErrors.translate("ollama", requestFailure(new ConnectException("refused"))).getKind())
                .isEqualTo(ErrorKind.NETWORK_UNAVAILABLE);
        assertThat(UpstreamErrors.translate("ollama", new UnknownHostException("ollama.local")).getKind())
                .isEqualTo(ErrorKind.NETWORK_UNAVAILABLE);
        assertThat(UpstreamErrors.translate("openai", new TimeoutException("Did not observe any item")).getKind())
                .isEqualTo(ErrorKind.UPSTREAM_TIMEOUT);
    }

    @Test
    void shouldMapDecodeFailuresToMalformed() {
        assertThat(UpstreamErrors.translate("openai", new DecodingException("JSON decoding error")).getKind())
                .isEqualTo(ErrorKind.MALFORMED_UPSTREAM_RESPONSE);
    }

    @Test
    void shouldMapFullBulkheadToQuota() {
        BulkheadFullException full = BulkheadFullException.createBulkheadFullException(Bulkhead.ofDefaults("generation-ollama"));

        assertThat(UpstreamErrors.translate("ollama", full).getKind()).isEqualTo(ErrorKind.QUOTA_EXCEEDED);
    }

    @Test
    void shouldPassTypedErrorsThrough() {
        UpstreamException original = UpstreamErrors.malformed("azure", "missing field DisplayText");

        assertThat(UpstreamErrors.translate("azure", original)).isSameAs(original);
    }

    @Test
    void shouldRefuseNonUpstreamKind() {
        assertThatThrownBy(() -> new UpstreamException(ErrorKind.CONFIG_CONFLICT, "openai", "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
