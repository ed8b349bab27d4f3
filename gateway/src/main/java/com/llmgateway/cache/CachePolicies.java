package com.llmgateway.cache;

import com.llmgateway.config.GatewayProperties;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPatternParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered endpoint policies; the first matching pattern wins.
 */
public class CachePolicies {

    private final List<CachePolicy> policies;

    public CachePolicies(List<CachePolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public static CachePolicies from(GatewayProperties.CacheSettings settings) {
        PathPatternParser parser = PathPatternParser.defaultInstance;
        List<CachePolicy> policies = new ArrayList<>();
        for (GatewayProperties.EndpointPolicy endpoint : settings.getEndpoints()) {
            if (endpoint.getPattern() == null || endpoint.getPattern().isBlank()) {
                throw new IllegalArgumentException("Cache endpoint policy needs a pattern");
            }
            if (endpoint.getMaxAgeSeconds() < 0) {
                throw new IllegalArgumentException("Negative max-age for cache pattern " + endpoint.getPattern());
            }
            policies.add(new CachePolicy(parser.parse(endpoint.getPattern()), endpoint.getMaxAgeSeconds(),
                    settings.isNoTransform(), endpoint.isMustRevalidate()));
        }
        return new CachePolicies(policies);
    }

    public Optional<CachePolicy> match(PathContainer path) {
        return policies.stream()
                .filter(policy -> policy.pattern().matches(path))
                .findFirst();
    }

    public int size() {
        return policies.size();
    }
}
