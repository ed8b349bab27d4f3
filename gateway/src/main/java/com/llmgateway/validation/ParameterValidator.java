package com.llmgateway.validation;

import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.registry.ModelSpec;
import com.llmgateway.registry.NumericRange;
import com.llmgateway.registry.ProviderDescriptor;
import com.llmgateway.registry.ProviderRegistry;
import com.llmgateway.registry.Tunable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks a request against the selected provider before anything touches
 * the network. Fails on the first offending field, in {@link Tunable} order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterValidator {

    private final ProviderRegistry registry;

    public void validate(String providerId, String modelId, GenerationParameters parameters) {
        ProviderDescriptor descriptor = registry.describe(providerId);
        validate(descriptor, descriptor.resolveModel(modelId), parameters);
    }

    /**
     * Every set field must be exposed by the provider and lie within its
     * bounds for this model. Unsupported fields are rejected, not dropped.
     */
    public void validate(ProviderDescriptor descriptor, ModelSpec model, GenerationParameters parameters) {
        if (parameters == null) {
            return;
        }
        for (Tunable tunable : Tunable.values()) {
            Number value = tunable.valueIn(parameters);
            if (value == null) {
                continue;
            }
            NumericRange range = descriptor.boundsFor(tunable, model);
            if (range == null) {
                log.debug("Rejected unsupported parameter: provider={}, field={}", descriptor.id(), tunable.field());
                throw ParameterValidationException.unsupported(tunable.field(), value, descriptor.id());
            }
            if (!range.contains(value.doubleValue())) {
                log.debug("Rejected parameter: provider={}, field={}, value={}, range={}",
                        descriptor.id(), tunable.field(), value, range);
                throw ParameterValidationException.outOfRange(tunable.field(), value, range);
            }
        }
    }

    public void validateConversation(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidConversationException("At least one message is required", "messages");
        }
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message == null) {
                throw new InvalidConversationException("Message " + i + " is empty", "messages[" + i + "]");
            }
            if (message.role() == null || !ChatMessage.ROLES.contains(message.role())) {
                throw new InvalidConversationException(
                        "Message " + i + " has unsupported role '" + message.role()
                                + "', expected one of system, user, assistant",
                        "messages[" + i + "].role");
            }
            if (message.content() == null || message.content().isBlank()) {
                throw new InvalidConversationException(
                        "Message " + i + " has no content", "messages[" + i + "].content");
            }
        }
    }
}
