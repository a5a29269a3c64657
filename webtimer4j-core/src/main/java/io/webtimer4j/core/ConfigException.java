package io.webtimer4j.core;

/**
 * Invalid schedule definition (bad cron expression, missing URL, ...).
 * Raised when the registry is mutated, so an invalid schedule never reaches the scheduler.
 */
public class ConfigException extends WebTimerException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
