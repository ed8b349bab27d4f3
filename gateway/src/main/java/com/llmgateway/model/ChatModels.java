package com.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llmgateway.error.NormalizedError;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * Inbound and outbound shapes of the chat surface.
 */
public final class ChatModels {

    private ChatModels() {
    }

    /**
     * The caller's choice of provider, model, endpoint and credential.
     * {@code credentialRef} names a stored credential; the secret itself is
     * never part of a request.
     */
    @Builder
    public record ModelConfiguration(
            @NotBlank(message = "provider is required") String provider,
            String modelId,
            String endpointOverride,
            String credentialRef
    ) {
    }

    public record ChatMessage(String role, String content) {

        public static final String SYSTEM = "system";
        public static final String USER = "user";
        public static final String ASSISTANT = "assistant";
        public static final Set<String> ROLES = Set.of(SYSTEM, USER, ASSISTANT);

        public static ChatMessage system(String content) {
            return new ChatMessage(SYSTEM, content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage(USER, content);
        }

        public static ChatMessage assistant(String content) {
            return new ChatMessage(ASSISTANT, content);
        }

        public boolean isSystem() {
            return SYSTEM.equals(role);
        }
    }

    /**
     * Optional overrides. Unset fields fall back to the provider's defaults.
     */
    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GenerationParameters(
            Double temperature,
            Integer maxTokens,
            Double topP,
            Integer topK,
            Double frequencyPenalty,
            Double presencePenalty
    ) {
        public static GenerationParameters none() {
            return new GenerationParameters(null, null, null, null, null, null);
        }
    }

    public record ChatDispatchRequest(
            @Valid @NotNull(message = "model is required") ModelConfiguration model,
            List<ChatMessage> messages,
            GenerationParameters parameters
    ) {
        public GenerationParameters parametersOrNone() {
            return parameters != null ? parameters : GenerationParameters.none();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CompletionResponse(String text, String finishReason, NormalizedError error) {
    }

    public record ModelCheckRequest(@Valid @NotNull(message = "model is required") ModelConfiguration model) {
    }

    public record ModelCheckResponse(boolean valid, String message) {
    }

    public record ErrorResponse(NormalizedError error) {
    }
}
