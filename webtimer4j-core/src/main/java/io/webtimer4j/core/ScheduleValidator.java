package io.webtimer4j.core;

import io.webtimer4j.utils.TriggerParser;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Rejects schedule definitions the scheduler could not run.
 */
public final class ScheduleValidator {

    private ScheduleValidator() {
    }

    public static Schedule validate(Schedule schedule) {
        if (schedule == null) {
            throw new ConfigException("schedule must not be null");
        }
        if (schedule.id().isBlank()) {
            throw new ConfigException("Required field 'id' is missing or empty");
        }
        validateUrl(schedule.url());
        TriggerParser.validate(schedule.trigger());

        if (schedule.timeout() != null && (schedule.timeout().isZero() || schedule.timeout().isNegative())) {
            throw new ConfigException("timeout must be a positive duration: " + schedule.id());
        }
        if (schedule.retryCount() != null && schedule.retryCount() < 0) {
            throw new ConfigException("retry count must not be negative: " + schedule.id());
        }
        if (schedule.retryDelay() != null && schedule.retryDelay().isNegative()) {
            throw new ConfigException("retry delay must not be negative: " + schedule.id());
        }
        for (var header : schedule.headers().entrySet()) {
            if (header.getKey() == null || header.getKey().isBlank() || header.getValue() == null) {
                throw new ConfigException("headers must have non-blank names and non-null values: " + schedule.id());
            }
        }
        return schedule;
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigException("Required field 'url' is missing or empty");
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new ConfigException("Invalid URL format: " + url);
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() == null) {
                throw new ConfigException("URL has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConfigException("Invalid URL format: " + url, e);
        }
    }
}
