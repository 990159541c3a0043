package com.globalnewsbrief.formatter.config;

import com.globalnewsbrief.core.model.Metadata;

/**
 * Values the formatter stamps onto every bulletin. Passed explicitly to each formatter instance.
 */
public record FormatterSettings(
        String llmModel,
        String version,
        String defaultSourceName,
        String defaultSourceUrl
) {
    public static final String DEFAULT_VERSION = "1.0";
    public static final String DEFAULT_SOURCE_NAME = "Perplexity";
    public static final String DEFAULT_SOURCE_URL = "https://www.perplexity.ai";

    public FormatterSettings {
        llmModel = orDefault(llmModel, Metadata.DEFAULT_LLM_MODEL);
        version = orDefault(version, DEFAULT_VERSION);
        defaultSourceName = orDefault(defaultSourceName, DEFAULT_SOURCE_NAME);
        defaultSourceUrl = orDefault(defaultSourceUrl, DEFAULT_SOURCE_URL);
    }

    public static FormatterSettings defaults() {
        return new FormatterSettings(null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
