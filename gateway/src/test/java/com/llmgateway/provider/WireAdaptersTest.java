package com.llmgateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.credential.ResolvedTarget;
import com.llmgateway.dispatch.MalformedChunkException;
import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.registry.ProviderCatalog;
import com.llmgateway.registry.ProviderDescriptor;
import com.llmgateway.registry.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireAdaptersTest {

    private static final List<ChatMessage> CONVERSATION = List.of(
            ChatMessage.system("Be brief."),
            ChatMessage.user("hi"),
            ChatMessage.assistant("hello"),
            ChatMessage.user("again"));

    private final ObjectMapper mapper = new ObjectMapper();
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(ProviderCatalog.defaults());
    }

    private ResolvedTarget target(String provider, String endpoint, String credential) {
        ProviderDescriptor descriptor = registry.describe(provider);
        return new ResolvedTarget(descriptor, descriptor.resolveModel(null), endpoint, credential);
    }

    @Nested
    class OpenAi {

        private final OpenAiWireAdapter adapter = new OpenAiWireAdapter(mapper);

        @Test
        @DisplayName("should build a streaming chat completions request")
        void shouldBuildRequest() {
            ResolvedTarget target = target("openai", "https://api.openai.com/v1", "sk-test");
            HttpHeaders headers = new HttpHeaders();
            adapter.writeHeaders(headers, target);

            Map<String, Object> body = adapter.requestBody(target, CONVERSATION,
                    GenerationParameters.builder().temperature(0.2).maxTokens(100).build());

            assertThat(adapter.streamUri(target)).hasToString("https://api.openai.com/v1/chat/completions");
            assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
            assertThat(body).containsEntry("model", "gpt-4o-mini")
                    .containsEntry("stream", true)
                    .containsEntry("temperature", 0.2)
                    .containsEntry("max_tokens", 100)
                    .doesNotContainKeys("top_p", "top_k");
            assertThat((List<?>) body.get("messages")).hasSize(4);
        }

        @Test
        @DisplayName("should decode deltas, the done sentinel and error payloads")
        void shouldTranslateFrames() {
            assertThat(adapter.translate("{\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}"))
                    .containsExactly(UpstreamChunk.text("Hi"));
            assertThat(adapter.translate("{\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}")).isEmpty();
            assertThat(adapter.translate("[DONE]")).containsExactly(UpstreamChunk.end());
            assertThat(adapter.translate("{\"error\":{\"type\":\"server_error\",\"message\":\"boom\"}}"))
                    .containsExactly(UpstreamChunk.failure("server_error: boom"));
            assertThat(adapter.translate("{\"choices\":[{\"delta\":{},\"finish_reason\":\"content_filter\"}]}"))
                    .extracting(UpstreamChunk::kind).containsExactly(UpstreamChunk.Kind.FAILURE);
        }

        @Test
        @DisplayName("should reject frames that are not JSON objects")
        void shouldRejectMalformedFrames() {
            assertThatThrownBy(() -> adapter.translate("{oops")).isInstanceOf(MalformedChunkException.class);
            assertThatThrownBy(() -> adapter.translate("[1,2]")).isInstanceOf(MalformedChunkException.class);
        }
    }

    @Nested
    class Anthropic {

        private final AnthropicWireAdapter adapter = new AnthropicWireAdapter(mapper);

        @Test
        @DisplayName("should hoist system text and default max_tokens to the model ceiling")
        @SuppressWarnings("unchecked")
        void shouldBuildRequest() {
            ResolvedTarget target = target("anthropic", "https://api.anthropic.com/v1", "sk-ant-test");
            HttpHeaders headers = new HttpHeaders();
            adapter.writeHeaders(headers, target);

            Map<String, Object> body = adapter.requestBody(target, CONVERSATION, GenerationParameters.builder().topK(5).build());

            assertThat(adapter.streamUri(target)).hasToString("https://api.anthropic.com/v1/messages");
            assertThat(headers.getFirst("x-api-key")).isEqualTo("sk-ant-test");
            assertThat(headers.getFirst("anthropic-version")).isEqualTo(AnthropicWireAdapter.API_VERSION);
            assertThat(headers.containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
            assertThat(body).containsEntry("system", "Be brief.")
                    .containsEntry("max_tokens", 8192)
                    .containsEntry("top_k", 5);
            assertThat((List<Map<String, String>>) body.get("messages"))
                    .extracting(m -> m.get("role"))
                    .containsExactly("user", "assistant", "user");
        }

        @Test
        @DisplayName("should decode text deltas, stop and error events")
        void shouldTranslateFrames() {
            assertThat(adapter.translate("{\"type\":\"message_start\",\"message\":{}}")).isEmpty();
            assertThat(adapter.translate(
                    "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi\"}}"))
                    .containsExactly(UpstreamChunk.text("Hi"));
            assertThat(adapter.translate("{\"type\":\"message_stop\"}")).containsExactly(UpstreamChunk.end());
            assertThat(adapter.translate(
                    "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}"))
                    .containsExactly(UpstreamChunk.failure("overloaded_error: Overloaded"));
        }
    }

    @Nested
    class Gemini {

        private final GeminiWireAdapter adapter = new GeminiWireAdapter(mapper);

        @Test
        @DisplayName("should map roles and keep the key out of the URL")
        @SuppressWarnings("unchecked")
        void shouldBuildRequest() {
            ResolvedTarget target = target("google", "https://generativelanguage.googleapis.com/v1beta", "AIza-test");
            HttpHeaders headers = new HttpHeaders();
            adapter.writeHeaders(headers, target);

            Map<String, Object> body = adapter.requestBody(target, CONVERSATION,
                    GenerationParameters.builder().maxTokens(256).build());

            assertThat(adapter.streamUri(target).toString())
                    .endsWith(":streamGenerateContent?alt=sse")
                    .doesNotContain("AIza-test");
            assertThat(headers.getFirst("x-goog-api-key")).isEqualTo("AIza-test");
            assertThat((List<Map<String, Object>>) body.get("contents"))
                    .extracting(m -> m.get("role"))
                    .containsExactly("user", "model", "user");
            assertThat(body).containsKey("systemInstruction");
            assertThat((Map<String, Object>) body.get("generationConfig")).containsEntry("maxOutputTokens", 256);
        }

        @Test
        @DisplayName("should decode candidate text and surface safety blocks as failures")
        void shouldTranslateFrames() {
            assertThat(adapter.translate("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hi\"}]}}]}"))
                    .containsExactly(UpstreamChunk.text("Hi"));
            assertThat(adapter.translate(
                    "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"!\"}]},\"finishReason\":\"STOP\"}]}"))
                    .containsExactly(UpstreamChunk.text("!"), UpstreamChunk.end());
            assertThat(adapter.translate("{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}"))
                    .singleElement()
                    .satisfies(chunk -> assertThat(chunk.text()).contains("safety"));
            assertThat(adapter.translate("{\"promptFeedback\":{\"blockReason\":\"OTHER\"}}"))
                    .extracting(UpstreamChunk::kind).containsExactly(UpstreamChunk.Kind.FAILURE);
        }
    }

    @Nested
    class Ollama {

        private final OllamaWireAdapter adapter = new OllamaWireAdapter(mapper);

        @Test
        @DisplayName("should put generation settings under options")
        @SuppressWarnings("unchecked")
        void shouldBuildRequest() {
            ResolvedTarget target = target("ollama", "http://localhost:11434", "");
            HttpHeaders headers = new HttpHeaders();
            adapter.writeHeaders(headers, target);

            Map<String, Object> body = adapter.requestBody(target, CONVERSATION,
                    GenerationParameters.builder().temperature(1.5).maxTokens(64).build());

            assertThat(adapter.streamUri(target)).hasToString("http://localhost:11434/api/chat");
            assertThat(headers.containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
            assertThat((Map<String, Object>) body.get("options"))
                    .containsEntry("temperature", 1.5)
                    .containsEntry("num_predict", 64);
        }

        @Test
        @DisplayName("should decode content lines and the done flag")
        void shouldTranslateFrames() {
            assertThat(adapter.translate("{\"message\":{\"content\":\"Hi\"},\"done\":false}"))
                    .containsExactly(UpstreamChunk.text("Hi"));
            assertThat(adapter.translate("{\"message\":{\"content\":\"\"},\"done\":true}"))
                    .containsExactly(UpstreamChunk.end());
            assertThat(adapter.translate("{\"error\":\"model 'x' not found\"}"))
                    .containsExactly(UpstreamChunk.failure("model 'x' not found"));
        }
    }

    @Test
    @DisplayName("should find one adapter per wire format")
    void shouldRegisterEveryFormat() {
        WireAdapters adapters = new WireAdapters(List.of(
                new OpenAiWireAdapter(mapper), new AnthropicWireAdapter(mapper),
                new GeminiWireAdapter(mapper), new OllamaWireAdapter(mapper)));

        for (ProviderDescriptor descriptor : registry.all()) {
            assertThat(adapters.forFormat(descriptor.wireFormat()).format()).isEqualTo(descriptor.wireFormat());
        }
        assertThatThrownBy(() -> new WireAdapters(List.of(new OpenAiWireAdapter(mapper), new OpenAiWireAdapter(mapper))))
                .isInstanceOf(IllegalStateException.class);
    }
}
