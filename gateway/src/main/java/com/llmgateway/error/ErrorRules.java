package com.llmgateway.error;

import com.llmgateway.dispatch.MalformedChunkException;
import com.llmgateway.dispatch.StreamIdleException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.PrematureCloseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.Set;

/**
 * The ordered classification table. First matching rule wins, so more
 * specific kinds must sit above the broad ones. Exception types are matched
 * across the whole table before status and text.
 */
public final class ErrorRules {

    private ErrorRules() {
    }

    // Billing exhaustion also says "quota" and often arrives as 429 or 403
    private static final List<String> BILLING = List.of(
            "insufficient_quota", "exceeded your current quota", "quota exceeded", "quota_exceeded",
            "billing", "payment", "credit balance");

    private static final List<ErrorRule> DEFAULTS = List.of(
            new ErrorRule(ErrorKind.RATE_LIMIT,
                    List.of("rate limit", "rate_limit", "ratelimit", "too many requests", "quota", "429"),
                    Set.of(429),
                    List.of(),
                    BILLING),
            new ErrorRule(ErrorKind.AUTHENTICATION,
                    List.of("api key", "api_key", "apikey", "unauthorized", "authentication",
                            "invalid_api_key", "permission denied", "401", "403"),
                    Set.of(401, 403),
                    List.of(),
                    BILLING),
            new ErrorRule(ErrorKind.MODEL_NOT_FOUND,
                    List.of("model not found", "model_not_found", "invalid model", "no such model",
                            "does not exist", "404"),
                    Set.of(404),
                    List.of(),
                    List.of()),
            new ErrorRule(ErrorKind.CONTEXT_LENGTH_EXCEEDED,
                    List.of("context_length_exceeded", "context length", "context window", "too long",
                            "maximum context", "tokens", "maximum"),
                    Set.of(413),
                    List.of(),
                    List.of()),
            new ErrorRule(ErrorKind.CONTENT_POLICY_VIOLATION,
                    List.of("content policy", "content_policy", "content_filter", "safety", "moderation",
                            "policy violation", "blocked"),
                    Set.of(),
                    List.of(),
                    List.of()),
            new ErrorRule(ErrorKind.INVALID_REQUEST,
                    List.of("invalid", "validation", "malformed", "bad request", "400"),
                    Set.of(400, 422),
                    List.of(MalformedChunkException.class),
                    List.of()),
            new ErrorRule(ErrorKind.NETWORK_ERROR,
                    List.of("network", "connection refused", "connection reset", "econnrefused", "etimedout",
                            "timed out", "failed to resolve", "dns"),
                    Set.of(),
                    List.of(ConnectException.class, UnknownHostException.class, SocketTimeoutException.class,
                            ClosedChannelException.class, PrematureCloseException.class,
                            WebClientRequestException.class),
                    List.of()),
            new ErrorRule(ErrorKind.SERVICE_UNAVAILABLE,
                    List.of("service unavailable", "overloaded", "bad gateway", "temporarily unavailable",
                            "maintenance", "502", "503", "504"),
                    Set.of(502, 503, 504, 529),
                    List.of(StreamIdleException.class),
                    List.of()),
            new ErrorRule(ErrorKind.PAYMENT_REQUIRED,
                    List.of("payment", "billing", "insufficient_quota", "exceeded your current quota",
                            "quota exceeded", "quota_exceeded", "credit balance", "402"),
                    Set.of(402),
                    List.of(),
                    List.of())
    );

    public static List<ErrorRule> defaults() {
        return DEFAULTS;
    }
}
