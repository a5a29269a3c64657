package io.webtimer4j.core;

import io.webtimer4j.utils.ContentHasher;

import java.util.Objects;

/**
 * Compares the hash of a successful response with the last successful hash of the same schedule.
 */
public class ChangeDetector {

    private final ContentHasher hasher;

    public ChangeDetector(ContentHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
    }

    /**
     * Detect a change and, on success only, store the new hash in {@code state}.
     */
    public ChangeResult detect(AttemptResult finalAttempt, JobRuntimeState state) {
        Objects.requireNonNull(finalAttempt, "finalAttempt must not be null");
        Objects.requireNonNull(state, "state must not be null");

        String previous = state.lastHash();
        if (!finalAttempt.success()) {
            return ChangeResult.notCompared(previous);
        }

        String current = hasher.hash(finalAttempt.body());
        state.updateLastHash(current);
        return new ChangeResult(previous == null || !previous.equals(current), previous, current);
    }
}
