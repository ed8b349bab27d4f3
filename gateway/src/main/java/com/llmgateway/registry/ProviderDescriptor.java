package com.llmgateway.registry;

import lombok.Builder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of one provider family: where it lives, which models
 * it serves and which generation parameters it accepts.
 */
@Builder
public record ProviderDescriptor(
        String id,
        String displayName,
        WireFormat wireFormat,
        String defaultEndpoint,
        boolean requiresCredential,
        boolean acceptsArbitraryModels,
        String defaultModel,
        int maxOutputCeiling,
        List<ModelSpec> models,
        Map<Tunable, NumericRange> tunables
) {

    public ProviderDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Provider id is required");
        }
        if (wireFormat == null) {
            throw new IllegalArgumentException("Wire format is required for provider " + id);
        }
        models = models != null ? List.copyOf(models) : List.of();
        EnumMap<Tunable, NumericRange> copy = new EnumMap<>(Tunable.class);
        if (tunables != null) {
            copy.putAll(tunables);
        }
        tunables = Collections.unmodifiableMap(copy);
        displayName = displayName != null ? displayName : id;
    }

    public Optional<ModelSpec> model(String modelId) {
        return models.stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst();
    }

    public boolean supports(Tunable tunable) {
        return tunables.containsKey(tunable);
    }

    /**
     * Picks the model a request runs against: the requested id, else the
     * provider default. Self-hosted style providers accept ids outside the
     * catalog, with the provider-wide output ceiling.
     */
    public ModelSpec resolveModel(String requestedId) {
        String modelId = requestedId != null && !requestedId.isBlank() ? requestedId.trim() : defaultModel;
        if (modelId == null) {
            throw new UnknownModelException(id, null);
        }
        Optional<ModelSpec> known = model(modelId);
        if (known.isPresent()) {
            return known.get();
        }
        if (acceptsArbitraryModels) {
            return new ModelSpec(modelId, modelId, 0, maxOutputCeiling);
        }
        throw new UnknownModelException(id, modelId);
    }

    /**
     * Legal range for a tunable against a given model, or null if the
     * provider does not expose the tunable at all.
     */
    public NumericRange boundsFor(Tunable tunable, ModelSpec model) {
        NumericRange declared = tunables.get(tunable);
        if (declared == null) {
            return null;
        }
        if (tunable == Tunable.MAX_TOKENS && model != null && model.maxOutputTokens() > 0) {
            return declared.withMax(model.maxOutputTokens());
        }
        return declared;
    }
}
