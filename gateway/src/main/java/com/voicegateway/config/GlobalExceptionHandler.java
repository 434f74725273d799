package com.voicegateway.config;

import com.voicegateway.exception.ConfigConflictException;
import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.exception.ErrorKind;
import com.voicegateway.exception.GatewayException;
import com.voicegateway.exception.RateLimitExceededException;
import com.voicegateway.exception.UpstreamException;
import com.voicegateway.model.VoiceModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<VoiceModels.ErrorResponse>> handleGatewayException(GatewayException ex) {
        ErrorKind kind = ex.getKind();
        VoiceModels.ErrorResponse.Error.ErrorBuilder error = VoiceModels.ErrorResponse.Error.builder()
                .type(typeOf(kind))
                .code(kind.code())
                .message(ex.getMessage());

        if (ex instanceof ConfigValidationException validation) {
            error.field(validation.getField());
        } else if (ex instanceof ConfigConflictException conflict) {
            error.attemptedVersion(conflict.getAttemptedVersion())
                    .currentVersion(conflict.getCurrentVersion());
        } else if (ex instanceof UpstreamException upstream) {
            error.diagnostic(upstream.getDiagnostic());
        }

        if (kind.status().is5xxServerError()) {
            log.warn("Request failed with {}: {}", kind.code(), ex.getMessage());
        } else {
            log.info("Request rejected with {}: {}", kind.code(), ex.getMessage());
        }
        return Mono.just(ResponseEntity.status(kind.status())
                .body(VoiceModels.ErrorResponse.builder().error(error.build()).build()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public Mono<ResponseEntity<VoiceModels.ErrorResponse>> handleRateLimitExceeded(RateLimitExceededException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(createErrorResponse("rate_limit_error", ex.getMessage(), "rate_limited")));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<VoiceModels.ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error",
                        ex.getReason() != null ? ex.getReason() : "Malformed request",
                        ErrorKind.REQUEST_VALIDATION_FAILED.code())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<VoiceModels.ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse("server_error", "An unexpected error occurred", "internal_error")));
    }

    private static String typeOf(ErrorKind kind) {
        if (kind.isUpstream()) {
            return "provider_error";
        }
        return kind == ErrorKind.CONFIG_CONFLICT ? "conflict_error" : "invalid_request_error";
    }

    private VoiceModels.ErrorResponse createErrorResponse(String type, String message, String code) {
        return VoiceModels.ErrorResponse.builder()
                .error(VoiceModels.ErrorResponse.Error.builder()
                        .type(type)
                        .message(message)
                        .code(code)
                        .build())
                .build();
    }
}
