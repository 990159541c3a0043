package com.globalnewsbrief.service.config;

import com.globalnewsbrief.formatter.config.FormatterSettings;
import com.globalnewsbrief.service.retry.RetrySettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsServiceConfigsOverDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("formatter.json"), """
                {"llmModel":"sonar-pro","defaultSourceName":"Newsroom"}
                """);
        Files.writeString(dir.resolve("retry.json"), """
                {"maxRetries":5,"maxDelaySeconds":10.0}
                """);

        FormatterSettings formatter = ConfigLoader.loadFormatter(dir);
        RetrySettings retry = ConfigLoader.loadRetry(dir);

        assertEquals("sonar-pro", formatter.llmModel());
        assertEquals("Newsroom", formatter.defaultSourceName());
        assertEquals("1.0", formatter.version());
        assertEquals(FormatterSettings.DEFAULT_SOURCE_URL, formatter.defaultSourceUrl());
        assertEquals(new RetrySettings(5, 1.0, 10.0), retry);
    }

    @Test
    void missingFilesGiveDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-empty-");

        assertEquals(FormatterSettings.defaults(), ConfigLoader.loadFormatter(dir));
        assertEquals(RetrySettings.defaults(), ConfigLoader.loadRetry(dir));
    }

    @Test
    void invalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(dir.resolve("formatter.json"), "{not-json");
        Files.writeString(dir.resolve("retry.json"), "{\"maxRetries\":0}");

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadFormatter(dir));
        assertTrue(invalid.getMessage().contains("formatter.json"));

        IllegalStateException outOfRange = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadRetry(dir));
        assertTrue(outOfRange.getMessage().contains("retry.json"));
    }
}
