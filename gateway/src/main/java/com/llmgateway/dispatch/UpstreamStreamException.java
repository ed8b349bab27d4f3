package com.llmgateway.dispatch;

import com.llmgateway.error.GatewayException;

/**
 * The provider reported an error inside an already open stream.
 */
public class UpstreamStreamException extends GatewayException {

    public UpstreamStreamException(String upstreamMessage) {
        super(upstreamMessage != null ? upstreamMessage : "upstream stream error");
    }
}
