package com.globalnewsbrief.formatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw payload returned by the text-generation API, consumed as an opaque structure.
 *
 * @param content   generated text, expected to embed the articles as JSON
 * @param citations citation entries, each either a {@code {title, url, publisher}} mapping or a bare URL
 * @param usage     token usage mapping; absent counts are treated as zero
 */
public record LlmResponse(
        String content,
        List<Object> citations,
        Map<String, Object> usage
) {
    public LlmResponse {
        citations = citations == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(citations));
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static LlmResponse ofContent(String content) {
        return new LlmResponse(content, List.of(), Map.of());
    }
}
