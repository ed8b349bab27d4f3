package com.llmgateway.error;

/**
 * A failure detected before any upstream call was made. These never carry
 * upstream text, so their kind and message are known at the throw site.
 */
public abstract class LocalFailureException extends GatewayException {

    protected LocalFailureException(String message) {
        super(message);
    }

    public abstract ErrorKind kind();

    /**
     * Name of the offending request field, if the failure is tied to one.
     */
    public String param() {
        return null;
    }
}
