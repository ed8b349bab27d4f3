package com.llmgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private Map<String, ProviderSettings> providers = new HashMap<>();
    private Map<String, String> credentials = new HashMap<>();
    private StreamSettings stream = new StreamSettings();
    private CacheSettings cache = new CacheSettings();

    public ProviderSettings providerSettings(String providerId) {
        ProviderSettings settings = providers.get(providerId);
        return settings != null ? settings : new ProviderSettings();
    }

    @Data
    public static class ProviderSettings {
        private boolean enabled = true;
        // Process-wide fallback credential for the provider family
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class StreamSettings {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration idleTimeout = Duration.ofSeconds(60);
        // Bounds reading the body of a non-2xx upstream reply
        private Duration responseTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class CacheSettings {
        private boolean enabled = true;
        private boolean noTransform = true;
        private List<EndpointPolicy> endpoints = new ArrayList<>();
    }

    @Data
    public static class EndpointPolicy {
        private String pattern;
        private long maxAgeSeconds = 300;
        private boolean mustRevalidate = false;
    }
}
