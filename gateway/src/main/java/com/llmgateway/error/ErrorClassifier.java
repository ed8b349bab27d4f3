package com.llmgateway.error;

import com.llmgateway.dispatch.UpstreamHttpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps any failure onto the fixed {@link ErrorKind} taxonomy. Classification
 * is total: it never throws and unrecognized input becomes {@link ErrorKind#UNKNOWN}.
 */
@Slf4j
@Component
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;
    private static final int MAX_LOGGED_DETAIL = 500;
    private static final long MAX_RETRY_SECONDS = 3600;

    private static final Pattern RETRY_AFTER_TEXT =
            Pattern.compile("retry[ _-]?after\\W{0,3}(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRY_AGAIN_TEXT =
            Pattern.compile("try again in (\\d+(?:\\.\\d+)?)\\s*(ms|s)\\b", Pattern.CASE_INSENSITIVE);

    private final List<ErrorRule> rules;
    private final SecretRedactor redactor;

    public ErrorClassifier() {
        this(ErrorRules.defaults(), new SecretRedactor());
    }

    public ErrorClassifier(List<ErrorRule> rules, SecretRedactor redactor) {
        this.rules = List.copyOf(rules);
        this.redactor = redactor;
    }

    public NormalizedError classify(Throwable failure) {
        return classify(failure, List.of());
    }

    /**
     * @param knownSecrets credential values in play for the request, masked
     *                     verbatim on top of the shape-based redaction
     */
    public NormalizedError classify(Throwable failure, Collection<String> knownSecrets) {
        Collection<String> secrets = knownSecrets != null ? knownSecrets : List.of();
        try {
            return doClassify(failure, secrets);
        } catch (RuntimeException e) {
            log.error("Failed to classify {}: {}", describe(failure), e.getClass().getSimpleName());
            return normalized(ErrorKind.UNKNOWN, ErrorKind.UNKNOWN.safeMessage(), null, null, secrets);
        }
    }

    public String redact(String text) {
        return redactor.redact(text);
    }

    private NormalizedError doClassify(Throwable failure, Collection<String> secrets) {
        if (failure == null) {
            return normalized(ErrorKind.UNKNOWN, ErrorKind.UNKNOWN.safeMessage(), null, null, secrets);
        }
        List<Throwable> chain = causeChain(Exceptions.unwrap(failure));

        for (Throwable t : chain) {
            if (t instanceof LocalFailureException local) {
                log.debug("Local failure: kind={}, param={}", local.kind().wireName(), local.param());
                return normalized(local.kind(), local.getMessage(), null, local.param(), secrets);
            }
        }

        int status = upstreamStatus(chain);
        String text = redactor.redact(failureText(chain), secrets).toLowerCase(Locale.ROOT);
        FailureView view = new FailureView(status, text, chain);

        ErrorKind kind = firstMatch(rule -> rule.matchesType(view))
                .or(() -> firstMatch(rule -> rule.matchesSignal(view)))
                .orElse(ErrorKind.UNKNOWN);

        Long retryAfter = kind == ErrorKind.RATE_LIMIT || kind == ErrorKind.SERVICE_UNAVAILABLE
                ? retryAfterSeconds(kind, chain, text)
                : null;

        log.warn("Upstream failure classified: kind={}, status={}, type={}, detail={}",
                kind.wireName(), status, chain.get(0).getClass().getSimpleName(), abbreviate(text));
        return normalized(kind, kind.safeMessage(), retryAfter, null, secrets);
    }

    private Optional<ErrorKind> firstMatch(Predicate<ErrorRule> test) {
        return rules.stream().filter(test).map(ErrorRule::kind).findFirst();
    }

    private NormalizedError normalized(ErrorKind kind, String message, Long retryAfter, String param,
                                       Collection<String> secrets) {
        String safe = message != null && !message.isBlank() ? message : kind.safeMessage();
        return new NormalizedError(kind, redactor.redact(safe, secrets), retryAfter, param);
    }

    private static List<Throwable> causeChain(Throwable root) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = root;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static int upstreamStatus(List<Throwable> chain) {
        for (Throwable t : chain) {
            if (t instanceof UpstreamHttpException http) {
                return http.getStatus();
            }
            if (t instanceof WebClientResponseException response) {
                return response.getStatusCode().value();
            }
        }
        return 0;
    }

    private static String failureText(List<Throwable> chain) {
        StringBuilder text = new StringBuilder();
        for (Throwable t : chain) {
            append(text, t.getMessage());
            if (t instanceof UpstreamHttpException http) {
                append(text, http.getBody());
            } else if (t instanceof WebClientResponseException response) {
                append(text, response.getResponseBodyAsString());
            }
        }
        return text.toString();
    }

    private static void append(StringBuilder text, String part) {
        if (part != null && !part.isBlank()) {
            if (text.length() > 0) {
                text.append(" | ");
            }
            text.append(part);
        }
    }

    /**
     * Header first, then a hint embedded in the error text, then the kind's default.
     */
    private static Long retryAfterSeconds(ErrorKind kind, List<Throwable> chain, String text) {
        for (Throwable t : chain) {
            if (t instanceof UpstreamHttpException http && http.getRetryAfter() != null) {
                return clamp(http.getRetryAfter());
            }
        }
        Matcher retryAfter = RETRY_AFTER_TEXT.matcher(text);
        if (retryAfter.find()) {
            return clamp(Duration.ofMillis((long) Math.ceil(Double.parseDouble(retryAfter.group(1)) * 1000)));
        }
        Matcher tryAgain = TRY_AGAIN_TEXT.matcher(text);
        if (tryAgain.find()) {
            double amount = Double.parseDouble(tryAgain.group(1));
            long millis = "ms".equalsIgnoreCase(tryAgain.group(2)) ? (long) amount : (long) Math.ceil(amount * 1000);
            return clamp(Duration.ofMillis(millis));
        }
        Duration fallback = kind.defaultRetryAfter();
        return fallback != null ? fallback.toSeconds() : null;
    }

    private static long clamp(Duration wait) {
        long seconds = (wait.toMillis() + 999) / 1000;
        return Math.max(1, Math.min(seconds, MAX_RETRY_SECONDS));
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_LOGGED_DETAIL ? text : text.substring(0, MAX_LOGGED_DETAIL) + "...";
    }

    private static String describe(Throwable failure) {
        return failure != null ? failure.getClass().getSimpleName() : "null";
    }
}
