package com.llmgateway.config;

import com.llmgateway.error.ErrorClassifier;
import com.llmgateway.error.GatewayException;
import com.llmgateway.error.NormalizedError;
import com.llmgateway.error.RequestShapeException;
import com.llmgateway.model.ChatModels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Renders failures on the non-streaming endpoints. Everything goes through
 * the classifier so the JSON shape matches in-stream error frames.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorClassifier classifier;

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        FieldError first = ex.getBindingResult().getFieldErrors().stream().findFirst().orElse(null);
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return respond(new RequestShapeException(message, first != null ? first.getField() : null));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(new RequestShapeException("Request body is missing or malformed", null));
    }

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleGatewayException(GatewayException ex) {
        return respond(ex);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleStatusException(ResponseStatusException ex) {
        log.debug("Framework status: {}", ex.getStatusCode());
        return Mono.just(ResponseEntity.status(ex.getStatusCode()).build());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error: type={}, message={}",
                ex.getClass().getName(), classifier.redact(String.valueOf(ex.getMessage())));
        log.debug("Unexpected error trace", ex);
        return respond(ex);
    }

    private Mono<ResponseEntity<ChatModels.ErrorResponse>> respond(Throwable failure) {
        NormalizedError error = classifier.classify(failure);
        return Mono.just(ResponseEntity.status(error.getKind().httpStatus())
                .body(new ChatModels.ErrorResponse(error)));
    }
}
