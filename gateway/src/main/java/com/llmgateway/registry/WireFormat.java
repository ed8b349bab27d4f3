package com.llmgateway.registry;

/**
 * Upstream request/response dialects. Several provider families share one.
 */
public enum WireFormat {
    OPENAI_CHAT,
    ANTHROPIC_MESSAGES,
    GEMINI_GENERATE,
    OLLAMA_CHAT
}
