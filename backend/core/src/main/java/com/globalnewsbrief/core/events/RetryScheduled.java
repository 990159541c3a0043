package com.globalnewsbrief.core.events;

import java.time.Instant;

public record RetryScheduled(
        Instant timestamp,
        String operation,
        int failedAttempt,
        int maxAttempts,
        long delayMillis,
        String error
) implements Event {
    @Override
    public String type() {
        return "RetryScheduled";
    }
}
