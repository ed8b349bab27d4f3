package com.llmgateway.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Caller-safe description of a failure. Only {@link ErrorClassifier} creates
 * these; the message never holds upstream text or credentials.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PACKAGE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NormalizedError {

    private final ErrorKind kind;
    private final String message;
    // Suggested wait in seconds before retrying
    private final Long retryAfter;
    private final String param;
}
