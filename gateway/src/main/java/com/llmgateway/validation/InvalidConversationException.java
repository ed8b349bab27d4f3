package com.llmgateway.validation;

import com.llmgateway.error.ErrorKind;
import com.llmgateway.error.LocalFailureException;

public class InvalidConversationException extends LocalFailureException {

    private final String param;

    public InvalidConversationException(String message, String param) {
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
