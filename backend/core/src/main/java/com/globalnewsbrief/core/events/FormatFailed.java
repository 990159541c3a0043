package com.globalnewsbrief.core.events;

import java.time.Instant;

/**
 * Published when a formatting run fails. {@code kind} is one of
 * {@code EMPTY_CONTENT}, {@code MALFORMED_CONTENT} or {@code VALIDATION}.
 */
public record FormatFailed(
        Instant timestamp,
        String kind,
        String message,
        int violationCount
) implements Event {
    @Override
    public String type() {
        return "FormatFailed";
    }
}
