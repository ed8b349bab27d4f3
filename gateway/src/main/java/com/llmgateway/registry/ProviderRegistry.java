package com.llmgateway.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup over the provider table. Built once at startup and shared
 * by every request.
 */
public class ProviderRegistry {

    private final Map<String, ProviderDescriptor> descriptors;

    public ProviderRegistry(List<ProviderDescriptor> descriptors) {
        Map<String, ProviderDescriptor> byId = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : descriptors) {
            String key = normalize(descriptor.id());
            if (byId.putIfAbsent(key, descriptor) != null) {
                throw new IllegalArgumentException("Duplicate provider id: " + descriptor.id());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byId);
    }

    public Optional<ProviderDescriptor> find(String providerId) {
        if (providerId == null) return Optional.empty();
        return Optional.ofNullable(descriptors.get(normalize(providerId)));
    }

    public ProviderDescriptor describe(String providerId) {
        return find(providerId).orElseThrow(() -> new UnknownProviderException(providerId));
    }

    public Collection<ProviderDescriptor> all() {
        return descriptors.values();
    }

    public int size() {
        return descriptors.size();
    }

    private static String normalize(String providerId) {
        return providerId.trim().toLowerCase(Locale.ROOT);
    }
}
