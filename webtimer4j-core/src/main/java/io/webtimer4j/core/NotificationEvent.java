package io.webtimer4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Classified outcome of one firing. Built, dispatched and discarded; never persisted.
 */
public record NotificationEvent(
        NotificationType type,
        Schedule schedule,
        AttemptResult result,
        ChangeResult change,
        Instant createdAt
) {

    public NotificationEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(change, "change must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}
