package com.llmgateway.dispatch;

import com.llmgateway.error.GatewayException;

/**
 * A stream frame could not be decoded.
 */
public class MalformedChunkException extends GatewayException {

    public MalformedChunkException(String message, Throwable cause) {
        super(message, cause);
    }
}
