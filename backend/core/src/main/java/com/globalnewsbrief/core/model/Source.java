package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

public record Source(
        String name,
        String url,
        @JsonProperty("published_at") Instant publishedAt
) {
    public Source {
        Violations violations = new Violations();
        violations.required("name", name);
        violations.httpUrl("url", url);
        violations.throwIfAny("Source");
    }

    public static Source of(String name, String url) {
        return new Source(name, url, null);
    }

    /**
     * Builds a source whose publication time arrives as text. The text must be ISO-8601 with an
     * explicit offset; a local date-time without one is rejected.
     */
    public static Source of(String name, String url, String publishedAt) {
        Violations violations = new Violations();
        Instant parsed = parseTimestamp(publishedAt, violations);
        Source source = violations.capture("", () -> new Source(name, url, parsed));
        violations.throwIfAny("Source");
        return source;
    }

    private static Instant parseTimestamp(String text, Violations violations) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text.trim()).toInstant();
        } catch (DateTimeParseException e) {
            violations.add("published_at", Violation.Rule.FORMAT,
                    "must be an ISO-8601 timestamp with offset (was '" + text + "')");
            return null;
        }
    }
}
