package com.globalnewsbrief.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.globalnewsbrief.core.util.JsonUtils;
import com.globalnewsbrief.formatter.api.LlmResponse;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads a saved upstream response. Accepts either the flat {@code {content, citations, usage}}
 * form or the chat-completions form, where the text sits at {@code choices[0].message.content}.
 */
public final class ResponseReader {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private ResponseReader() {
    }

    /**
     * @throws IOException          when the file cannot be read; worth retrying
     * @throws UncheckedIOException when the file is read but is not JSON; retrying cannot help
     */
    public static LlmResponse read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromTree(MAPPER.readTree(in));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Response file " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static LlmResponse fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Response document must be a JSON object");
        }
        JsonNode contentNode = root.has("choices")
                ? root.path("choices").path(0).path("message").path("content")
                : root.path("content");
        String content = contentNode.isTextual() ? contentNode.asText() : null;
        List<Object> citations = root.path("citations").isArray()
                ? MAPPER.convertValue(root.path("citations"), new TypeReference<List<Object>>() {
                })
                : List.of();
        Map<String, Object> usage = root.path("usage").isObject()
                ? MAPPER.convertValue(root.path("usage"), new TypeReference<Map<String, Object>>() {
                })
                : Map.of();
        return new LlmResponse(content, citations, usage);
    }
}
