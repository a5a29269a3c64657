package io.webtimer4j.core;

import io.webtimer4j.utils.TriggerParser;

import java.time.Instant;
import java.util.Locale;

public enum TriggerKind {
    INTERVAL("interval") {
        @Override
        public Instant nextDue(Trigger trigger, Instant lastDue, Instant now) {
            return TriggerParser.nextIntervalDue(trigger.intervalSeconds(), lastDue, now);
        }
    },
    CRON("cron") {
        @Override
        public Instant nextDue(Trigger trigger, Instant lastDue, Instant now) {
            return TriggerParser.nextCronDue(trigger.cronExpression(), trigger.timezone(), now);
        }
    };

    private final String configValue;

    TriggerKind(String configValue) {
        this.configValue = configValue;
    }

    /**
     * Next due time strictly after {@code now}.
     *
     * @param lastDue the due time that just fired, or null when the trigger is being armed
     */
    public abstract Instant nextDue(Trigger trigger, Instant lastDue, Instant now);

    public String configValue() {
        return configValue;
    }

    public static TriggerKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return INTERVAL;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (TriggerKind kind : values()) {
            if (kind.configValue.equals(v)) {
                return kind;
            }
        }
        throw new ConfigException("Unsupported schedule type: " + value);
    }
}
