package com.llmgateway.error;

/**
 * Base type for every failure the gateway raises itself.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
