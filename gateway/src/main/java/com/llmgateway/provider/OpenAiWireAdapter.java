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

/**
 * OpenAI chat completions, also spoken by Groq, OpenRouter and most
 * self-hosted servers.
 */
@Component
public class OpenAiWireAdapter extends JsonWireAdapter {

    static final String DONE_SENTINEL = "[DONE]";

    public OpenAiWireAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public WireFormat format() {
        return WireFormat.OPENAI_CHAT;
    }

    @Override
    public URI streamUri(ResolvedTarget target) {
        return URI.create(target.endpoint() + "/chat/completions");
    }

    @Override
    public void writeHeaders(HttpHeaders headers, ResolvedTarget target) {
        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
        if (target.hasCredential()) {
            headers.setBearerAuth(target.credential());
        }
    }

    @Override
    public Map<String, Object> requestBody(ResolvedTarget target, List<ChatMessage> messages,
                                           GenerationParameters parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", target.model().id());
        List<Map<String, String>> wireMessages = new ArrayList<>();
        for (ChatMessage message : messages) {
            wireMessages.add(Map.of("role", message.role(), "content", message.content()));
        }
        body.put("messages", wireMessages);
        body.put("stream", true);
        putIfSet(body, "temperature", parameters.temperature());
        putIfSet(body, "max_tokens", parameters.maxTokens());
        putIfSet(body, "top_p", parameters.topP());
        putIfSet(body, "top_k", parameters.topK());
        putIfSet(body, "frequency_penalty", parameters.frequencyPenalty());
        putIfSet(body, "presence_penalty", parameters.presencePenalty());
        return body;
    }

    @Override
    public List<UpstreamChunk> translate(String frame) {
        if (DONE_SENTINEL.equals(frame.trim())) {
            return List.of(UpstreamChunk.end());
        }
        JsonNode node = parse(frame);
        if (node.has("error")) {
            return List.of(UpstreamChunk.failure(errorText(node.get("error"))));
        }
        JsonNode choice = node.path("choices").path(0);
        if (choice.isMissingNode()) {
            return List.of();
        }
        if ("content_filter".equals(choice.path("finish_reason").asText(null))) {
            return List.of(UpstreamChunk.failure("content_filter: response stopped by the provider's content filter"));
        }
        JsonNode content = choice.path("delta").path("content");
        if (content.isTextual() && !content.asText().isEmpty()) {
            return List.of(UpstreamChunk.text(content.asText()));
        }
        return List.of();
    }
}
