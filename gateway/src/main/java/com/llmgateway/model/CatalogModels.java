package com.llmgateway.model;

import com.llmgateway.registry.ModelSpec;
import com.llmgateway.registry.NumericRange;
import com.llmgateway.registry.ProviderDescriptor;
import com.llmgateway.registry.Tunable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views of the provider table. Field and entry order is fixed so
 * the same table always serializes to the same bytes.
 */
public final class CatalogModels {

    private CatalogModels() {
    }

    public record ModelView(String id, String name, int contextWindow, int maxOutputTokens) {

        public static ModelView of(ModelSpec spec) {
            return new ModelView(spec.id(), spec.name(), spec.contextWindow(), spec.maxOutputTokens());
        }
    }

    public record ProviderView(
            String id,
            String displayName,
            String wireFormat,
            String defaultEndpoint,
            boolean requiresCredential,
            boolean acceptsArbitraryModels,
            String defaultModel,
            Map<String, NumericRange> parameters,
            List<ModelView> models
    ) {

        public static ProviderView of(ProviderDescriptor descriptor) {
            Map<String, NumericRange> parameters = new LinkedHashMap<>();
            for (Tunable tunable : Tunable.values()) {
                NumericRange range = descriptor.tunables().get(tunable);
                if (range != null) {
                    parameters.put(tunable.field(), range);
                }
            }
            return new ProviderView(
                    descriptor.id(),
                    descriptor.displayName(),
                    descriptor.wireFormat().name(),
                    descriptor.defaultEndpoint(),
                    descriptor.requiresCredential(),
                    descriptor.acceptsArbitraryModels(),
                    descriptor.defaultModel(),
                    parameters,
                    descriptor.models().stream().map(ModelView::of).toList());
        }
    }
}
