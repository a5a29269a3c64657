package io.webtimer4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * When a schedule fires: every {@code intervalSeconds}, or at each match of a 5/6-field cron expression.
 *
 * <p>{@code timezone} is an IANA zone id used by cron triggers; null means the engine default.
 */
public record Trigger(
        TriggerKind kind,
        long intervalSeconds,
        String cronExpression,
        String timezone
) {

    public Trigger {
        Objects.requireNonNull(kind, "kind must not be null");
        cronExpression = (cronExpression == null || cronExpression.isBlank()) ? null : cronExpression.trim();
        timezone = (timezone == null || timezone.isBlank()) ? null : timezone.trim();
    }

    public static Trigger interval(long seconds) {
        return new Trigger(TriggerKind.INTERVAL, seconds, null, null);
    }

    public static Trigger cron(String expression) {
        return new Trigger(TriggerKind.CRON, 0, expression, null);
    }

    public static Trigger cron(String expression, String timezone) {
        return new Trigger(TriggerKind.CRON, 0, expression, timezone);
    }

    public Trigger withTimezone(String timezone) {
        return new Trigger(kind, intervalSeconds, cronExpression, timezone);
    }

    public Instant nextDue(Instant lastDue, Instant now) {
        return kind.nextDue(this, lastDue, now);
    }

    public String describe() {
        return kind == TriggerKind.INTERVAL
                ? "every " + intervalSeconds + "s"
                : "cron '" + cronExpression + "'" + (timezone != null ? " " + timezone : "");
    }
}
