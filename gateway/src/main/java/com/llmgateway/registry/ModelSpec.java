package com.llmgateway.registry;

/**
 * A model a provider serves, with its token limits.
 *
 * @param contextWindow   input plus output tokens the model accepts, 0 when unknown
 * @param maxOutputTokens ceiling for the maxTokens parameter
 */
public record ModelSpec(String id, String name, int contextWindow, int maxOutputTokens) {
}
