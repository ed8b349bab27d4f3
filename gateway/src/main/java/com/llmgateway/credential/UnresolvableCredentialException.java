package com.llmgateway.credential;

import com.llmgateway.error.ErrorKind;
import com.llmgateway.error.LocalFailureException;

public class UnresolvableCredentialException extends LocalFailureException {

    private final String param;

    public UnresolvableCredentialException(String message, String param) {
        super(message);
        this.param = param;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHENTICATION;
    }

    @Override
    public String param() {
        return param;
    }
}
