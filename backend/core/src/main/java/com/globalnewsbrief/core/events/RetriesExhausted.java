package com.globalnewsbrief.core.events;

import java.time.Instant;

public record RetriesExhausted(Instant timestamp, String operation, int attempts, String error) implements Event {
    @Override
    public String type() {
        return "RetriesExhausted";
    }
}
