package com.llmgateway.error;

/**
 * The request body itself was unreadable or failed bean validation.
 */
public class RequestShapeException extends LocalFailureException {

    private final String param;

    public RequestShapeException(String message, String param) {
        super(message);
        this.param = param;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_REQUEST;
    }

    @Override
    public String param() {
        return param;
    }
}
