package com.llmgateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.credential.ResolvedTarget;
import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.registry.WireFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Google Gemini {@code streamGenerateContent} in SSE mode. The key travels in
 * a header so it never shows up in a logged URL.
 */
@Component
public class GeminiWireAdapter extends JsonWireAdapter {

    private static final Set<String> BLOCKING_FINISH_REASONS =
            Set.of("SAFETY", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII", "RECITATION");

    public GeminiWireAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public WireFormat format() {
        return WireFormat.GEMINI_GENERATE;
    }

    @Override
    public URI streamUri(ResolvedTarget target) {
        return URI.create(target.endpoint() + "/models/" + target.model().id() + ":streamGenerateContent?alt=sse");
    }

    @Override
    public void writeHeaders(HttpHeaders headers, ResolvedTarget target) {
        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
        if (target.hasCredential()) {
            headers.set("x-goog-api-key", target.credential());
        }
    }

    @Override
    public Map<String, Object> requestBody(ResolvedTarget target, List<ChatMessage> messages,
                                           GenerationParameters parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.isSystem()) {
                continue;
            }
            String role = ChatMessage.ASSISTANT.equals(message.role()) ? "model" : "user";
            contents.add(Map.of("role", role, "parts", List.of(Map.of("text", message.content()))));
        }
        body.put("contents", contents);

        String system = messages.stream()
                .filter(ChatMessage::isSystem)
                .map(ChatMessage::content)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
        }

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        putIfSet(generationConfig, "temperature", parameters.temperature());
        putIfSet(generationConfig, "maxOutputTokens", parameters.maxTokens());
        putIfSet(generationConfig, "topP", parameters.topP());
        putIfSet(generationConfig, "topK", parameters.topK());
        putIfSet(generationConfig, "frequencyPenalty", parameters.frequencyPenalty());
        putIfSet(generationConfig, "presencePenalty", parameters.presencePenalty());
        if (!generationConfig.isEmpty()) {
            body.put("generationConfig", generationConfig);
        }
        return body;
    }

    @Override
    public List<UpstreamChunk> translate(String frame) {
        JsonNode node = parse(frame);
        if (node.has("error")) {
            return List.of(UpstreamChunk.failure(errorText(node.get("error"))));
        }
        String blockReason = node.path("promptFeedback").path("blockReason").asText(null);
        if (blockReason != null) {
            return List.of(UpstreamChunk.failure("Prompt blocked by safety filter (" + blockReason + ")"));
        }

        JsonNode candidate = node.path("candidates").path(0);
        List<UpstreamChunk> chunks = new ArrayList<>();
        for (JsonNode part : candidate.path("content").path("parts")) {
            String text = part.path("text").asText("");
            if (!text.isEmpty()) {
                chunks.add(UpstreamChunk.text(text));
            }
        }
        String finishReason = candidate.path("finishReason").asText("");
        if (BLOCKING_FINISH_REASONS.contains(finishReason)) {
            chunks.add(UpstreamChunk.failure("Response blocked by safety filter (" + finishReason + ")"));
        } else if (!finishReason.isEmpty()) {
            chunks.add(UpstreamChunk.end());
        }
        return chunks;
    }
}
