package com.globalnewsbrief.core.events;

import java.time.Instant;

public record BulletinFormatted(
        Instant timestamp,
        String bulletinId,
        int articleCount,
        double processingTimeSeconds
) implements Event {
    @Override
    public String type() {
        return "BulletinFormatted";
    }
}
