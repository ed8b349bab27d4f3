package com.llmgateway.credential;

import com.llmgateway.registry.ModelSpec;
import com.llmgateway.registry.ProviderDescriptor;

/**
 * Where and as whom one dispatch talks upstream. The credential is empty for
 * providers that need none.
 */
public record ResolvedTarget(ProviderDescriptor provider, ModelSpec model, String endpoint, String credential) {

    public boolean hasCredential() {
        return credential != null && !credential.isEmpty();
    }

    @Override
    public String toString() {
        return "ResolvedTarget[provider=" + provider.id()
                + ", model=" + model.id()
                + ", endpoint=" + endpoint
                + ", credential=" + (hasCredential() ? "****" : "none") + "]";
    }
}
