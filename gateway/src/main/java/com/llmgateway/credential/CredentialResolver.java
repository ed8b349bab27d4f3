package com.llmgateway.credential;

import com.llmgateway.config.GatewayProperties;
import com.llmgateway.model.ChatModels.ModelConfiguration;
import com.llmgateway.registry.ModelSpec;
import com.llmgateway.registry.ProviderDescriptor;
import com.llmgateway.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Picks the credential and endpoint for a model configuration.
 * <p>
 * Credential order: the stored credential named by {@code credentialRef},
 * then the provider's process-wide key, then none if the provider runs
 * without one. A reference that names nothing is an error and does not fall
 * back. Endpoint order: the configuration's override, then the deployment's
 * {@code base-url}, then the provider default.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final ProviderRegistry registry;
    private final CredentialStore credentialStore;
    private final GatewayProperties properties;

    public ResolvedTarget resolve(ModelConfiguration config) {
        ProviderDescriptor descriptor = registry.describe(config.provider());
        return resolve(config, descriptor, descriptor.resolveModel(config.modelId()));
    }

    public ResolvedTarget resolve(ModelConfiguration config, ProviderDescriptor descriptor, ModelSpec model) {
        GatewayProperties.ProviderSettings settings = properties.providerSettings(descriptor.id());
        String endpoint = resolveEndpoint(config, descriptor, settings);
        String credential = resolveCredential(config, descriptor, settings);

        log.debug("Resolved target: provider={}, model={}, endpoint={}, credentialSource={}",
                descriptor.id(), model.id(), endpoint,
                config.credentialRef() != null ? "stored" : credential.isEmpty() ? "none" : "fallback");
        return new ResolvedTarget(descriptor, model, endpoint, credential);
    }

    private String resolveCredential(ModelConfiguration config, ProviderDescriptor descriptor,
                                     GatewayProperties.ProviderSettings settings) {
        String ref = config.credentialRef();
        if (ref != null && !ref.isBlank()) {
            return credentialStore.lookup(ref.trim())
                    .orElseThrow(() -> new UnresolvableCredentialException(
                            "No stored credential found for reference '" + ref.trim() + "'", "credentialRef"));
        }
        String fallback = settings.getApiKey();
        if (fallback != null && !fallback.isBlank()) {
            return fallback.trim();
        }
        if (!descriptor.requiresCredential()) {
            return "";
        }
        throw new UnresolvableCredentialException(
                "No API key is configured for provider '" + descriptor.id()
                        + "'. Attach a stored credential to the model configuration.", "credentialRef");
    }

    private String resolveEndpoint(ModelConfiguration config, ProviderDescriptor descriptor,
                                   GatewayProperties.ProviderSettings settings) {
        String endpoint = EndpointSanitizer.sanitize(config.endpointOverride());
        if (endpoint == null) {
            endpoint = EndpointSanitizer.sanitize(settings.getBaseUrl());
        }
        if (endpoint == null) {
            endpoint = descriptor.defaultEndpoint();
        }
        if (endpoint == null) {
            throw new UnresolvableCredentialException(
                    "Provider '" + descriptor.id() + "' has no default endpoint; an endpoint override is required",
                    "endpointOverride");
        }
        requireHttpUrl(endpoint);
        return endpoint;
    }

    private static void requireHttpUrl(String endpoint) {
        try {
            URI uri = new URI(endpoint);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new UnresolvableCredentialException(
                        "Endpoint must be an absolute http or https URL", "endpointOverride");
            }
        } catch (URISyntaxException e) {
            throw new UnresolvableCredentialException("Endpoint is not a valid URL", "endpointOverride");
        }
    }
}
