package io.webtimer4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * UDP notification target and emission policy.
 *
 * <ul>
 *   <li>{@code delay}: wait before each datagram is sent; does not affect scheduling</li>
 *   <li>{@code maxResponseSizeBytes}: cap of the body echoed in a datagram</li>
 *   <li>{@code suppressRepeatedFailures}: drop a failure whose error equals the previous firing's failure</li>
 * </ul>
 */
public record NotificationSettings(
        boolean enabled,
        String serverAddress,
        int port,
        Duration delay,
        boolean notifyOnSuccess,
        boolean notifyOnFailure,
        boolean notifyOnResponseChange,
        int maxResponseSizeBytes,
        boolean suppressRepeatedFailures
) {

    public NotificationSettings {
        serverAddress = (serverAddress == null || serverAddress.isBlank()) ? "localhost" : serverAddress;
        delay = delay == null ? Duration.ZERO : delay;
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxResponseSizeBytes < 0) {
            throw new IllegalArgumentException("maxResponseSizeBytes must not be negative");
        }
    }

    public static NotificationSettings disabled() {
        return new NotificationSettings(false, "localhost", 12345, Duration.ofSeconds(1),
                true, true, true, 1024, false);
    }

    /**
     * Emission gate. {@code recovery} and {@code first_success} count as success-class events.
     */
    public boolean allows(NotificationType type) {
        Objects.requireNonNull(type, "type must not be null");
        if (!enabled) {
            return false;
        }
        return switch (type) {
            case FAILURE -> notifyOnFailure;
            case RESPONSE_CHANGED -> notifyOnResponseChange;
            case FIRST_SUCCESS, SUCCESS_NO_CHANGE, RECOVERY -> notifyOnSuccess;
        };
    }
}
