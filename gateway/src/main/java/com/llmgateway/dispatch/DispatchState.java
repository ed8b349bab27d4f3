package com.llmgateway.dispatch;

/**
 * Lifecycle of one dispatch. The last three are terminal.
 */
public enum DispatchState {
    IDLE,
    VALIDATING,
    RESOLVING,
    CONNECTING,
    STREAMING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
