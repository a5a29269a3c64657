package io.webtimer4j.core;

import java.time.Duration;

/**
 * Identifies one attempt of a firing.
 *
 * @param requestId shared by every attempt of the same firing
 * @param attempt   1-based position in the retry sequence
 * @param timeout   upper bound for the whole attempt
 */
public record AttemptContext(
        String requestId,
        int attempt,
        Duration timeout
) {
}
