package com.globalnewsbrief.core.events;

import java.time.Instant;

public record FallbackApplied(
        Instant timestamp,
        String articleId,
        String field,
        String detail
) implements Event {
    @Override
    public String type() {
        return "FallbackApplied";
    }
}
