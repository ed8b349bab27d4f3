package com.llmgateway.cache;

import org.springframework.http.CacheControl;
import org.springframework.web.util.pattern.PathPattern;

import java.time.Duration;

/**
 * Freshness rules for the endpoints matching one path pattern. Responses
 * are always marked private.
 */
public record CachePolicy(PathPattern pattern, long maxAgeSeconds, boolean noTransform, boolean mustRevalidate) {

    public CacheControl cacheControl() {
        CacheControl control = CacheControl.maxAge(Duration.ofSeconds(maxAgeSeconds)).cachePrivate();
        if (noTransform) {
            control = control.noTransform();
        }
        if (mustRevalidate) {
            control = control.mustRevalidate();
        }
        return control;
    }
}
