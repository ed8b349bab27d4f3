package com.llmgateway.credential;

import java.util.Optional;

/**
 * Source of stored secrets, addressed by opaque reference.
 */
public interface CredentialStore {

    Optional<String> lookup(String credentialRef);
}
