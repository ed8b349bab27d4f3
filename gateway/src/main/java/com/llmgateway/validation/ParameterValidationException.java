package com.llmgateway.validation;

import com.llmgateway.error.ErrorKind;
import com.llmgateway.error.LocalFailureException;
import com.llmgateway.registry.NumericRange;

/**
 * A generation parameter is outside the provider's bounds, or the provider
 * does not accept it at all (in which case {@link #getAllowedRange()} is null).
 */
public class ParameterValidationException extends LocalFailureException {

    private final String field;
    private final Number value;
    private final NumericRange allowedRange;

    private ParameterValidationException(String message, String field, Number value, NumericRange allowedRange) {
        super(message);
        this.field = field;
        this.value = value;
        this.allowedRange = allowedRange;
    }

    public static ParameterValidationException outOfRange(String field, Number value, NumericRange range) {
        return new ParameterValidationException(
                "Parameter '" + field + "' value " + value + " is outside the allowed range " + range,
                field, value, range);
    }

    public static ParameterValidationException unsupported(String field, Number value, String providerId) {
        return new ParameterValidationException(
                "Parameter '" + field + "' is not supported by provider '" + providerId + "'",
                field, value, null);
    }

    public String getField() {
        return field;
    }

    public Number getValue() {
        return value;
    }

    public NumericRange getAllowedRange() {
        return allowedRange;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_REQUEST;
    }

    @Override
    public String param() {
        return field;
    }
}
