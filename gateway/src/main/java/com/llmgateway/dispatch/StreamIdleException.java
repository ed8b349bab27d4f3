package com.llmgateway.dispatch;

import com.llmgateway.error.GatewayException;

/**
 * Upstream kept the connection open but stopped sending frames.
 */
public class StreamIdleException extends GatewayException {

    public StreamIdleException() {
        super("upstream went silent past the idle timeout");
    }
}
