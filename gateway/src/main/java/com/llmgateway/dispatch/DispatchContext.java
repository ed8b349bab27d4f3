package com.llmgateway.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Per-request state. Created fresh for every dispatch and never shared.
 * Transitions may race between the upstream thread and caller cancellation;
 * whichever reaches a terminal state first wins.
 */
@Slf4j
class DispatchContext {

    private final String requestId;
    private final long startNanos = System.nanoTime();
    private final AtomicReference<DispatchState> state = new AtomicReference<>(DispatchState.IDLE);
    private final Consumer<DispatchState> observer;
    private volatile String providerId = "unknown";
    private volatile String credential;

    DispatchContext(String requestId, Consumer<DispatchState> observer) {
        this.requestId = requestId;
        this.observer = observer;
    }

    /**
     * Moves to the given state unless already there or already terminal.
     */
    boolean transition(DispatchState next) {
        DispatchState current;
        do {
            current = state.get();
            if (current == next || current.isTerminal()) {
                return false;
            }
        } while (!state.compareAndSet(current, next));
        log.debug("Dispatch state: requestId={}, {} -> {}", requestId, current, next);
        observer.accept(next);
        return true;
    }

    DispatchState state() {
        return state.get();
    }

    String requestId() {
        return requestId;
    }

    String providerId() {
        return providerId;
    }

    void providerId(String providerId) {
        this.providerId = providerId;
    }

    void credential(String credential) {
        this.credential = credential;
    }

    /**
     * Values the classifier must mask verbatim in anything it logs or returns.
     */
    List<String> secrets() {
        String value = credential;
        return value == null || value.isEmpty() ? List.of() : List.of(value);
    }

    long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }
}
