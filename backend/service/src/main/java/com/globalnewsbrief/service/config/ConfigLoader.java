package com.globalnewsbrief.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.globalnewsbrief.core.util.JsonUtils;
import com.globalnewsbrief.formatter.config.FormatterSettings;
import com.globalnewsbrief.service.retry.RetrySettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads optional JSON settings files. A missing file yields the defaults; fields absent from a
 * present file keep their default values.
 */
public final class ConfigLoader {
    public static final String FORMATTER_FILE = "formatter.json";
    public static final String RETRY_FILE = "retry.json";

    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private ConfigLoader() {
    }

    public static FormatterSettings loadFormatter(Path configDir) {
        return read(configDir.resolve(FORMATTER_FILE), FormatterSettings.defaults(), FormatterSettings.class);
    }

    public static RetrySettings loadRetry(Path configDir) {
        return read(configDir.resolve(RETRY_FILE), RetrySettings.defaults(), RetrySettings.class);
    }

    private static <T> T read(Path path, T defaults, Class<T> type) {
        if (!Files.exists(path)) {
            return defaults;
        }
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode overrides = MAPPER.readTree(in);
            if (overrides == null || !overrides.isObject()) {
                throw new IllegalStateException("Failed loading config from " + path + ": expected a JSON object");
            }
            ObjectNode merged = MAPPER.valueToTree(defaults);
            merged.setAll((ObjectNode) overrides);
            return MAPPER.treeToValue(merged, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
