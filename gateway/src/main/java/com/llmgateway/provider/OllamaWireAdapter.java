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
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ollama {@code /api/chat}. Streams newline-delimited JSON rather than SSE.
 */
@Component
public class OllamaWireAdapter extends JsonWireAdapter {

    public OllamaWireAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public WireFormat format() {
        return WireFormat.OLLAMA_CHAT;
    }

    @Override
    public URI streamUri(ResolvedTarget target) {
        return URI.create(target.endpoint() + "/api/chat");
    }

    @Override
    public void writeHeaders(HttpHeaders headers, ResolvedTarget target) {
        headers.setAccept(List.of(MediaType.APPLICATION_NDJSON));
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

        Map<String, Object> options = new LinkedHashMap<>();
        putIfSet(options, "temperature", parameters.temperature());
        putIfSet(options, "num_predict", parameters.maxTokens());
        putIfSet(options, "top_p", parameters.topP());
        putIfSet(options, "top_k", parameters.topK());
        putIfSet(options, "frequency_penalty", parameters.frequencyPenalty());
        putIfSet(options, "presence_penalty", parameters.presencePenalty());
        if (!options.isEmpty()) {
            body.put("options", options);
        }
        return body;
    }

    @Override
    public Flux<String> frames(ClientResponse response) {
        return response.bodyToFlux(String.class)
                .filter(line -> !line.isBlank());
    }

    @Override
    public List<UpstreamChunk> translate(String frame) {
        JsonNode node = parse(frame);
        if (node.has("error")) {
            return List.of(UpstreamChunk.failure(errorText(node.get("error"))));
        }
        List<UpstreamChunk> chunks = new ArrayList<>();
        String content = node.path("message").path("content").asText("");
        if (!content.isEmpty()) {
            chunks.add(UpstreamChunk.text(content));
        }
        if (node.path("done").asBoolean(false)) {
            chunks.add(UpstreamChunk.end());
        }
        return chunks;
    }
}
