package io.webtimer4j.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered attempts of one firing. The last attempt is the one that gets classified.
 */
public record FiringResult(List<AttemptResult> attempts) {

    public FiringResult {
        if (attempts == null || attempts.isEmpty()) {
            throw new IllegalArgumentException("attempts must not be empty");
        }
        attempts = List.copyOf(attempts);
    }

    public AttemptResult finalAttempt() {
        return attempts.get(attempts.size() - 1);
    }

    public boolean succeeded() {
        return finalAttempt().success();
    }

    public FiringResult withFinalAttempt(AttemptResult replacement) {
        List<AttemptResult> copy = new ArrayList<>(attempts);
        copy.set(copy.size() - 1, replacement);
        return new FiringResult(copy);
    }
}
