package io.webtimer4j.history;

import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.HttpMethod;
import io.webtimer4j.core.Schedule;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Persisted projection of one attempt. Append-only: a stored record is never modified.
 *
 * <p>{@code sequence} is assigned by the store on append and is null before that.
 */
public record HistoryRecord(
        Long sequence,
        String scheduleId,
        String scheduleName,
        String requestId,
        Instant timestamp,
        String url,
        HttpMethod method,
        boolean success,
        Integer statusCode,
        Long responseTimeMs,
        int attempt,
        String errorMessage,
        String responseBody,
        String responseHash
) {

    public HistoryRecord {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * Project an attempt, storing at most {@code maxStoredBodyBytes} of its body.
     */
    public static HistoryRecord of(Schedule schedule, AttemptResult result, int maxStoredBodyBytes) {
        return new HistoryRecord(
                null,
                schedule.id(),
                schedule.name(),
                result.requestId(),
                result.timestamp(),
                schedule.url(),
                schedule.method(),
                result.success(),
                result.statusCode(),
                result.responseTimeMs(),
                result.attempt(),
                result.error(),
                capBody(result.body(), maxStoredBodyBytes),
                result.contentHash()
        );
    }

    public HistoryRecord withSequence(long sequence) {
        return new HistoryRecord(sequence, scheduleId, scheduleName, requestId, timestamp, url, method, success,
                statusCode, responseTimeMs, attempt, errorMessage, responseBody, responseHash);
    }

    private static String capBody(byte[] body, int maxBytes) {
        if (body == null || body.length == 0 || maxBytes <= 0) {
            return null;
        }
        byte[] kept = body.length > maxBytes ? Arrays.copyOf(body, maxBytes) : body;
        return new String(kept, StandardCharsets.UTF_8);
    }
}
