package com.llmgateway.credential;

import java.util.List;

/**
 * Normalizes user-entered endpoints to a base URL. People paste the full
 * completions URL from provider docs; adapters append their own paths.
 */
public final class EndpointSanitizer {

    private static final List<String> OPERATION_SUFFIXES = List.of(
            "/v1/chat/completions", "/v1/completions", "/chat/completions", "/completions");

    private EndpointSanitizer() {
    }

    public static String sanitize(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        String base = stripTrailingSlashes(endpoint.trim());
        for (String suffix : OPERATION_SUFFIXES) {
            if (base.endsWith(suffix)) {
                base = base.substring(0, base.length() - suffix.length());
                break;
            }
        }
        base = stripTrailingSlashes(base);
        return base.isEmpty() ? null : base;
    }

    private static String stripTrailingSlashes(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
