package com.llmgateway.registry;

import java.util.List;
import java.util.Map;

import static com.llmgateway.registry.Tunable.FREQUENCY_PENALTY;
import static com.llmgateway.registry.Tunable.MAX_TOKENS;
import static com.llmgateway.registry.Tunable.PRESENCE_PENALTY;
import static com.llmgateway.registry.Tunable.TEMPERATURE;
import static com.llmgateway.registry.Tunable.TOP_K;
import static com.llmgateway.registry.Tunable.TOP_P;

/**
 * Built-in provider table. Adding a provider means adding a row here and,
 * if it speaks a new dialect, a wire adapter.
 */
public final class ProviderCatalog {

    public static final int OPEN_MODEL_CEILING = 1_000_000;

    private static final NumericRange UNIT = NumericRange.of(0, 1);
    private static final NumericRange PENALTY = NumericRange.of(-2, 2);

    private ProviderCatalog() {
    }

    public static List<ProviderDescriptor> defaults() {
        return List.of(openai(), anthropic(), google(), groq(), ollama(), openrouter(), custom());
    }

    static ProviderDescriptor openai() {
        return ProviderDescriptor.builder()
                .id("openai")
                .displayName("OpenAI")
                .wireFormat(WireFormat.OPENAI_CHAT)
                .defaultEndpoint("https://api.openai.com/v1")
                .requiresCredential(true)
                .defaultModel("gpt-4o-mini")
                .maxOutputCeiling(16384)
                .models(List.of(
                        new ModelSpec("gpt-4o", "GPT-4o", 128000, 4096),
                        new ModelSpec("gpt-4o-mini", "GPT-4o Mini", 128000, 16384),
                        new ModelSpec("gpt-4-turbo", "GPT-4 Turbo", 128000, 4096),
                        new ModelSpec("gpt-4", "GPT-4", 8192, 8192),
                        new ModelSpec("gpt-3.5-turbo", "GPT-3.5 Turbo", 16385, 4096)))
                .tunables(Map.of(
                        TEMPERATURE, NumericRange.of(0, 2),
                        MAX_TOKENS, NumericRange.of(1, 16384),
                        TOP_P, UNIT,
                        FREQUENCY_PENALTY, PENALTY,
                        PRESENCE_PENALTY, PENALTY))
                .build();
    }

    static ProviderDescriptor anthropic() {
        return ProviderDescriptor.builder()
                .id("anthropic")
                .displayName("Anthropic")
                .wireFormat(WireFormat.ANTHROPIC_MESSAGES)
                .defaultEndpoint("https://api.anthropic.com/v1")
                .requiresCredential(true)
                .defaultModel("claude-3-5-sonnet-20241022")
                .maxOutputCeiling(8192)
                .models(List.of(
                        new ModelSpec("claude-3-5-sonnet-20241022", "Claude 3.5 Sonnet", 200000, 8192),
                        new ModelSpec("claude-3-5-haiku-20241022", "Claude 3.5 Haiku", 200000, 8192),
                        new ModelSpec("claude-3-opus-20240229", "Claude 3 Opus", 200000, 4096),
                        new ModelSpec("claude-3-sonnet-20240229", "Claude 3 Sonnet", 200000, 4096),
                        new ModelSpec("claude-3-haiku-20240307", "Claude 3 Haiku", 200000, 4096)))
                .tunables(Map.of(
                        TEMPERATURE, UNIT,
                        MAX_TOKENS, NumericRange.of(1, 8192),
                        TOP_P, UNIT,
                        TOP_K, NumericRange.of(0, 100)))
                .build();
    }

    static ProviderDescriptor google() {
        return ProviderDescriptor.builder()
                .id("google")
                .displayName("Google Gemini")
                .wireFormat(WireFormat.GEMINI_GENERATE)
                .defaultEndpoint("https://generativelanguage.googleapis.com/v1beta")
                .requiresCredential(true)
                .defaultModel("gemini-1.5-flash")
                .maxOutputCeiling(8192)
                .models(List.of(
                        new ModelSpec("gemini-2.0-flash-exp", "Gemini 2.0 Flash", 1000000, 8192),
                        new ModelSpec("gemini-1.5-pro", "Gemini 1.5 Pro", 2000000, 8192),
                        new ModelSpec("gemini-1.5-flash", "Gemini 1.5 Flash", 1000000, 8192),
                        new ModelSpec("gemini-1.0-pro", "Gemini 1.0 Pro", 32000, 2048)))
                .tunables(Map.of(
                        TEMPERATURE, NumericRange.of(0, 2),
                        MAX_TOKENS, NumericRange.of(1, 8192),
                        TOP_P, UNIT,
                        TOP_K, NumericRange.of(0, 100)))
                .build();
    }

    static ProviderDescriptor groq() {
        return ProviderDescriptor.builder()
                .id("groq")
                .displayName("Groq")
                .wireFormat(WireFormat.OPENAI_CHAT)
                .defaultEndpoint("https://api.groq.com/openai/v1")
                .requiresCredential(true)
                .defaultModel("llama-3.3-70b-versatile")
                .maxOutputCeiling(32768)
                .models(List.of(
                        new ModelSpec("llama-3.3-70b-versatile", "Llama 3.3 70B", 128000, 8192),
                        new ModelSpec("llama-3.1-70b-versatile", "Llama 3.1 70B", 128000, 8192),
                        new ModelSpec("mixtral-8x7b-32768", "Mixtral 8x7B", 32768, 32768),
                        new ModelSpec("gemma2-9b-it", "Gemma 2 9B", 8192, 8192)))
                .tunables(Map.of(
                        TEMPERATURE, NumericRange.of(0, 2),
                        MAX_TOKENS, NumericRange.of(1, 32768),
                        TOP_P, UNIT,
                        FREQUENCY_PENALTY, PENALTY,
                        PRESENCE_PENALTY, PENALTY))
                .build();
    }

    static ProviderDescriptor ollama() {
        return ProviderDescriptor.builder()
                .id("ollama")
                .displayName("Ollama")
                .wireFormat(WireFormat.OLLAMA_CHAT)
                .defaultEndpoint("http://localhost:11434")
                .requiresCredential(false)
                .acceptsArbitraryModels(true)
                .defaultModel("llama3.2")
                .maxOutputCeiling(OPEN_MODEL_CEILING)
                .models(List.of(
                        new ModelSpec("llama3.3", "Llama 3.3", 128000, 4096),
                        new ModelSpec("llama3.2", "Llama 3.2", 128000, 4096),
                        new ModelSpec("mistral", "Mistral", 8192, 4096),
                        new ModelSpec("codellama", "Code Llama", 16384, 4096),
                        new ModelSpec("qwen2.5", "Qwen 2.5", 128000, 8192)))
                .tunables(openTunables())
                .build();
    }

    static ProviderDescriptor openrouter() {
        return ProviderDescriptor.builder()
                .id("openrouter")
                .displayName("OpenRouter")
                .wireFormat(WireFormat.OPENAI_CHAT)
                .defaultEndpoint("https://openrouter.ai/api/v1")
                .requiresCredential(true)
                .acceptsArbitraryModels(true)
                .defaultModel("openai/gpt-4o-mini")
                .maxOutputCeiling(OPEN_MODEL_CEILING)
                .tunables(openTunables())
                .build();
    }

    static ProviderDescriptor custom() {
        return ProviderDescriptor.builder()
                .id("custom")
                .displayName("Custom OpenAI-compatible")
                .wireFormat(WireFormat.OPENAI_CHAT)
                .requiresCredential(true)
                .acceptsArbitraryModels(true)
                .maxOutputCeiling(OPEN_MODEL_CEILING)
                .tunables(openTunables())
                .build();
    }

    private static Map<Tunable, NumericRange> openTunables() {
        return Map.of(
                TEMPERATURE, NumericRange.of(0, 2),
                MAX_TOKENS, NumericRange.of(1, OPEN_MODEL_CEILING),
                TOP_P, UNIT,
                TOP_K, NumericRange.of(0, 100),
                FREQUENCY_PENALTY, PENALTY,
                PRESENCE_PENALTY, PENALTY);
    }
}
