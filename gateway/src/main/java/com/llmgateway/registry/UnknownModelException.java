package com.llmgateway.registry;

import com.llmgateway.error.ErrorKind;
import com.llmgateway.error.LocalFailureException;

public class UnknownModelException extends LocalFailureException {

    private final String providerId;
    private final String modelId;

    public UnknownModelException(String providerId, String modelId) {
        super(modelId == null
                ? "No model id given and provider '" + providerId + "' has no default model"
                : "Model '" + modelId + "' is not offered by provider '" + providerId + "'");
        this.providerId = providerId;
        this.modelId = modelId;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelId() {
        return modelId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MODEL_NOT_FOUND;
    }

    @Override
    public String param() {
        return "modelId";
    }
}
