package com.globalnewsbrief.formatter.normalize;

import com.globalnewsbrief.core.model.Period;
import com.globalnewsbrief.core.model.Region;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-run values that are not part of the generated text.
 *
 * @param date          {@code YYYY-MM-DD}, or {@code null} for the current UTC date
 * @param startedAt     when the run began; processing time is measured from here
 * @param workflowRunId optional opaque id of the workflow that triggered the run
 */
public record BulletinContext(
        Region region,
        Period period,
        String date,
        Instant startedAt,
        String workflowRunId
) {
    public BulletinContext {
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(period, "period is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
    }
}
