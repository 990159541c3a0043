package com.globalnewsbrief.formatter.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.globalnewsbrief.core.util.JsonUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the JSON payload inside generated text and returns its article entries as loosely
 * typed mappings, in source order.
 *
 * <p>Two payload shapes are accepted: a bare array of article objects, or an object holding that
 * array under {@code articles}. Any other well-formed JSON yields no articles.
 */
public final class ContentExtractor {
    private static final Pattern FENCED_BLOCK = Pattern.compile("```[A-Za-z0-9_+-]*[ \\t]*\\r?\\n?(.*?)```", Pattern.DOTALL);
    private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public ContentExtractor() {
        this(JsonUtils.objectMapper());
    }

    public ContentExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<Map<String, Object>> extractArticles(String content) {
        if (content == null || content.isBlank()) {
            throw new EmptyContentException("Empty content received from API");
        }
        String text = content.trim();
        JsonNode root;
        try {
            root = reader.readTree(text);
        } catch (JsonProcessingException unfenced) {
            root = parseFenced(content, unfenced);
        }

        JsonNode articles = articlesNode(root);
        List<Map<String, Object>> result = new ArrayList<>();
        for (int i = 0; i < articles.size(); i++) {
            JsonNode entry = articles.get(i);
            if (!entry.isObject()) {
                throw new MalformedContentException(
                        "Invalid JSON in content: article entry " + i + " is " + entry.getNodeType() + ", expected an object",
                        null
                );
            }
            result.add(mapper.convertValue(entry, MAPPING));
        }
        return result;
    }

    /**
     * Text that is not JSON as a whole is retried with the body of its first fenced block, so
     * backticks inside JSON string values never count as a fence.
     */
    private JsonNode parseFenced(String content, JsonProcessingException unfenced) {
        Optional<String> body = fencedBody(content);
        if (body.isEmpty()) {
            throw new MalformedContentException("Invalid JSON in content: " + unfenced.getOriginalMessage(), unfenced);
        }
        if (body.get().isEmpty()) {
            throw new MalformedContentException("Invalid JSON in content: fenced block is empty", unfenced);
        }
        try {
            return reader.readTree(body.get());
        } catch (JsonProcessingException e) {
            throw new MalformedContentException("Invalid JSON in content: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Body of the first fenced block, trimmed.
     */
    private static Optional<String> fencedBody(String content) {
        Matcher matcher = FENCED_BLOCK.matcher(content);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    private JsonNode articlesNode(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        if (root.isObject() && root.path("articles").isArray()) {
            return root.get("articles");
        }
        return mapper.createArrayNode();
    }
}
