package io.webtimer4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Global attempt policy used where a schedule leaves a value unset.
 */
public record RequestDefaults(
        Duration timeout,
        int retryCount,
        Duration retryDelay
) {

    public RequestDefaults {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
    }

    public static RequestDefaults defaults() {
        return new RequestDefaults(Duration.ofSeconds(30), 3, Duration.ofSeconds(5));
    }

    public Duration timeoutFor(Schedule schedule) {
        return schedule.timeout() != null ? schedule.timeout() : timeout;
    }

    public int retryCountFor(Schedule schedule) {
        return schedule.retryCount() != null ? schedule.retryCount() : retryCount;
    }

    public Duration retryDelayFor(Schedule schedule) {
        return schedule.retryDelay() != null ? schedule.retryDelay() : retryDelay;
    }
}
