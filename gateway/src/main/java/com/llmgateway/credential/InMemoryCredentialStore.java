package com.llmgateway.credential;

import java.util.Map;
import java.util.Optional;

/**
 * Credential store backed by the {@code gateway.credentials} map.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> secrets;

    public InMemoryCredentialStore(Map<String, String> secrets) {
        this.secrets = secrets != null ? Map.copyOf(secrets) : Map.of();
    }

    @Override
    public Optional<String> lookup(String credentialRef) {
        if (credentialRef == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(secrets.get(credentialRef))
                .filter(secret -> !secret.isBlank());
    }
}
