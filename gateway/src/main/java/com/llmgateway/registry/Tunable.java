package com.llmgateway.registry;

import com.llmgateway.model.ChatModels.GenerationParameters;

/**
 * Generation parameters a provider may expose, in validation order.
 */
public enum Tunable {
    TEMPERATURE("temperature"),
    MAX_TOKENS("maxTokens"),
    TOP_P("topP"),
    TOP_K("topK"),
    FREQUENCY_PENALTY("frequencyPenalty"),
    PRESENCE_PENALTY("presencePenalty");

    private final String field;

    Tunable(String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }

    /**
     * Returns the value set for this tunable, or null when the caller left it unset.
     */
    public Number valueIn(GenerationParameters parameters) {
        if (parameters == null) return null;
        return switch (this) {
            case TEMPERATURE -> parameters.temperature();
            case MAX_TOKENS -> parameters.maxTokens();
            case TOP_P -> parameters.topP();
            case TOP_K -> parameters.topK();
            case FREQUENCY_PENALTY -> parameters.frequencyPenalty();
            case PRESENCE_PENALTY -> parameters.presencePenalty();
        };
    }
}
