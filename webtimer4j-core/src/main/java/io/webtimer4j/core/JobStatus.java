package io.webtimer4j.core;

import java.time.Instant;

public record JobStatus(
        String id,
        String name,
        boolean enabled,
        JobState state,
        String trigger,
        Instant nextDueAt,
        Instant lastRunAt,
        Boolean lastSuccess,
        boolean consecutiveFailure,
        long runCount,
        long errorCount,
        long skippedCount
) {
}
