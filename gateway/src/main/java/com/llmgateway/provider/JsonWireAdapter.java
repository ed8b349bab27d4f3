package com.llmgateway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.dispatch.MalformedChunkException;

import java.util.Map;

/**
 * Shared JSON plumbing for adapters whose frames are JSON documents.
 */
abstract class JsonWireAdapter implements WireAdapter {

    protected final ObjectMapper objectMapper;

    protected JsonWireAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected JsonNode parse(String frame) {
        try {
            JsonNode node = objectMapper.readTree(frame);
            if (node == null || !node.isObject()) {
                throw new MalformedChunkException("Malformed " + format() + " stream frame: not a JSON object", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedChunkException("Malformed " + format() + " stream frame", e);
        }
    }

    protected static void putIfSet(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    /**
     * Reads the usual {@code {"error": {"type", "message"}}} shape, or a bare
     * string error, into one line of upstream text.
     */
    protected static String errorText(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        StringBuilder text = new StringBuilder();
        for (String field : new String[]{"type", "code", "status", "message"}) {
            JsonNode value = error.path(field);
            if (!value.isMissingNode() && !value.isNull()) {
                if (text.length() > 0) {
                    text.append(": ");
                }
                text.append(value.asText());
            }
        }
        return text.length() > 0 ? text.toString() : error.toString();
    }
}
