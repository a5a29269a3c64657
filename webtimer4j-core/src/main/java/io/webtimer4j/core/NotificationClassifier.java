package io.webtimer4j.core;

import java.util.Objects;

/**
 * Maps a firing outcome to exactly one {@link NotificationType}.
 *
 * <p>Precedence: failure, recovery, first success, changed, unchanged.
 */
public class NotificationClassifier {

    public NotificationType classify(AttemptResult finalAttempt, ChangeResult change, boolean previouslyFailing) {
        Objects.requireNonNull(finalAttempt, "finalAttempt must not be null");
        Objects.requireNonNull(change, "change must not be null");

        if (!finalAttempt.success()) {
            return NotificationType.FAILURE;
        }
        if (previouslyFailing) {
            return NotificationType.RECOVERY;
        }
        if (change.previousHash() == null) {
            return NotificationType.FIRST_SUCCESS;
        }
        if (!change.previousHash().equals(change.currentHash())) {
            return NotificationType.RESPONSE_CHANGED;
        }
        return NotificationType.SUCCESS_NO_CHANGE;
    }

    /**
     * Emission gate: the per-type flags, plus optional suppression of a failure identical to the previous one.
     */
    public boolean shouldEmit(NotificationType type, NotificationSettings settings,
                              boolean previouslyFailing, String previousError, String currentError) {
        if (settings == null || !settings.allows(type)) {
            return false;
        }
        return !(type == NotificationType.FAILURE
                && settings.suppressRepeatedFailures()
                && previouslyFailing
                && Objects.equals(previousError, currentError));
    }
}
