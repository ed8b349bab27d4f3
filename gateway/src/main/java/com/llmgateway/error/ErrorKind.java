package com.llmgateway.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Fixed error taxonomy, declared in classification priority order.
 * {@link #UNKNOWN} is the fallback and never matched by a rule.
 */
public enum ErrorKind {
    RATE_LIMIT("rate-limit", 429,
            "Rate limit exceeded. Please wait a moment and try again.", Duration.ofSeconds(60)),
    AUTHENTICATION("authentication", 401,
            "Invalid API key. Please check your provider credentials.", null),
    MODEL_NOT_FOUND("model-not-found", 404,
            "The specified model is not available or you do not have access to it.", null),
    CONTEXT_LENGTH_EXCEEDED("context-length-exceeded", 400,
            "The conversation is too long. Please start a new chat or reduce the message length.", null),
    CONTENT_POLICY_VIOLATION("content-policy-violation", 400,
            "The content was flagged by the safety filter. Please modify your message and try again.", null),
    INVALID_REQUEST("invalid-request", 400,
            "Invalid request format. Please check your input and try again.", null),
    NETWORK_ERROR("network-error", 503,
            "Network error. Please check your connection and try again.", null),
    SERVICE_UNAVAILABLE("service-unavailable", 503,
            "The service is temporarily unavailable. Please try again later.", Duration.ofSeconds(30)),
    PAYMENT_REQUIRED("payment-required", 402,
            "Payment required or quota exceeded. Please check your billing details.", null),
    UNKNOWN("unknown", 500,
            "An error occurred while processing your request.", null);

    private final String wireName;
    private final int httpStatus;
    private final String safeMessage;
    private final Duration defaultRetryAfter;

    ErrorKind(String wireName, int httpStatus, String safeMessage, Duration defaultRetryAfter) {
        this.wireName = wireName;
        this.httpStatus = httpStatus;
        this.safeMessage = safeMessage;
        this.defaultRetryAfter = defaultRetryAfter;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String safeMessage() {
        return safeMessage;
    }

    /**
     * Wait suggested to callers when upstream gave no hint, or null if retrying is pointless.
     */
    public Duration defaultRetryAfter() {
        return defaultRetryAfter;
    }
}
