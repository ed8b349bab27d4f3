package com.llmgateway.registry;

import com.llmgateway.error.ErrorKind;
import com.llmgateway.error.LocalFailureException;

public class UnknownProviderException extends LocalFailureException {

    private final String providerId;

    public UnknownProviderException(String providerId) {
        super("Unknown provider '" + providerId + "'");
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_REQUEST;
    }

    @Override
    public String param() {
        return "provider";
    }
}
