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
import java.util.stream.Collectors;

/**
 * Anthropic messages API. System messages move to the top-level
 * {@code system} field and {@code max_tokens} is mandatory.
 */
@Component
public class AnthropicWireAdapter extends JsonWireAdapter {

    static final String API_VERSION = "2023-06-01";
    private static final int FALLBACK_MAX_TOKENS = 4096;

    public AnthropicWireAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public WireFormat format() {
        return WireFormat.ANTHROPIC_MESSAGES;
    }

    @Override
    public URI streamUri(ResolvedTarget target) {
        return URI.create(target.endpoint() + "/messages");
    }

    @Override
    public void writeHeaders(HttpHeaders headers, ResolvedTarget target) {
        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
        headers.set("anthropic-version", API_VERSION);
        if (target.hasCredential()) {
            headers.set("x-api-key", target.credential());
        }
    }

    @Override
    public Map<String, Object> requestBody(ResolvedTarget target, List<ChatMessage> messages,
                                           GenerationParameters parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", target.model().id());
        int modelMax = target.model().maxOutputTokens();
        body.put("max_tokens", parameters.maxTokens() != null
                ? parameters.maxTokens()
                : modelMax > 0 ? modelMax : FALLBACK_MAX_TOKENS);

        String system = messages.stream()
                .filter(ChatMessage::isSystem)
                .map(ChatMessage::content)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        List<Map<String, String>> wireMessages = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (!message.isSystem()) {
                wireMessages.add(Map.of("role", message.role(), "content", message.content()));
            }
        }
        body.put("messages", wireMessages);
        body.put("stream", true);
        putIfSet(body, "temperature", parameters.temperature());
        putIfSet(body, "top_p", parameters.topP());
        putIfSet(body, "top_k", parameters.topK());
        return body;
    }

    @Override
    public List<UpstreamChunk> translate(String frame) {
        JsonNode node = parse(frame);
        switch (node.path("type").asText("")) {
            case "content_block_delta":
                JsonNode text = node.path("delta").path("text");
                if (text.isTextual() && !text.asText().isEmpty()) {
                    return List.of(UpstreamChunk.text(text.asText()));
                }
                return List.of();
            case "message_stop":
                return List.of(UpstreamChunk.end());
            case "error":
                return List.of(UpstreamChunk.failure(errorText(node.path("error"))));
            default:
                // message_start, content_block_start/stop, message_delta, ping
                return List.of();
        }
    }
}
