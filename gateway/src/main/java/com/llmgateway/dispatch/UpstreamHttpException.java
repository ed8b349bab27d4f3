package com.llmgateway.dispatch;

import com.llmgateway.error.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Upstream answered the stream request with a non-success status. The body
 * is raw provider text and must go through the classifier before anyone sees it.
 */
@Slf4j
public class UpstreamHttpException extends GatewayException {

    private final int status;
    private final String body;
    private final Duration retryAfter;

    public UpstreamHttpException(int status, String body, Duration retryAfter) {
        super("Upstream returned HTTP " + status);
        this.status = status;
        this.body = body != null ? body : "";
        this.retryAfter = retryAfter;
    }

    public static UpstreamHttpException from(HttpStatusCode status, String body, HttpHeaders headers) {
        String header = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        return new UpstreamHttpException(status.value(), body, parseRetryAfter(header));
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    /**
     * Wait advertised by the Retry-After header, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Accepts both delta-seconds and HTTP-date forms.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparseable Retry-After header: {}", value);
                return null;
            }
        }
    }
}
