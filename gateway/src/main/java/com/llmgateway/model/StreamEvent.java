package com.llmgateway.model;

import com.llmgateway.error.NormalizedError;

import java.util.Map;

/**
 * The only shape a caller ever observes from a dispatch, whatever the
 * upstream wire format was. A sequence is zero or more deltas followed by
 * exactly one {@link Done} or {@link Error}.
 */
public interface StreamEvent {

    String DELTA = "delta";
    String DONE = "done";
    String ERROR = "error";

    /**
     * Frame tag on the caller-facing stream.
     */
    String type();

    /**
     * Frame body on the caller-facing stream.
     */
    Object payload();

    static TextDelta delta(String text) {
        return new TextDelta(text);
    }

    static Done done() {
        return Done.INSTANCE;
    }

    static Error error(NormalizedError error) {
        return new Error(error);
    }

    record TextDelta(String text) implements StreamEvent {
        @Override
        public String type() {
            return DELTA;
        }

        @Override
        public Object payload() {
            return Map.of("text", text);
        }
    }

    record Done() implements StreamEvent {
        static final Done INSTANCE = new Done();

        @Override
        public String type() {
            return DONE;
        }

        @Override
        public Object payload() {
            return Map.of();
        }
    }

    record Error(NormalizedError error) implements StreamEvent {
        @Override
        public String type() {
            return ERROR;
        }

        @Override
        public Object payload() {
            return error;
        }
    }
}
