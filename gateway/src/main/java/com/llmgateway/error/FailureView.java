package com.llmgateway.error;

import java.util.List;

/**
 * What the rule table sees of a raw failure: upstream status (0 when there
 * was none), redacted lower-case text, and the cause chain.
 */
record FailureView(int status, String text, List<Throwable> chain) {

    boolean hasCause(Class<? extends Throwable> type) {
        return chain.stream().anyMatch(type::isInstance);
    }
}
