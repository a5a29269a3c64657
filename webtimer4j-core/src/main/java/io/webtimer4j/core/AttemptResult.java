package io.webtimer4j.core;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one HTTP attempt.
 *
 * <p>{@code statusCode} is null when no response arrived. {@code body} is capped by the executor;
 * {@code bodyTruncated} tells whether bytes were dropped. {@code contentHash} is filled in by the change
 * detector for successful attempts.
 */
public record AttemptResult(
        String requestId,
        String scheduleId,
        int attempt,
        Instant timestamp,
        boolean success,
        Integer statusCode,
        Duration responseTime,
        ErrorKind errorKind,
        String error,
        byte[] body,
        boolean bodyTruncated,
        String contentHash
) {

    public AttemptResult {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
    }

    public static AttemptResult success(AttemptContext ctx, String scheduleId, Instant timestamp, int statusCode,
                                        Duration responseTime, byte[] body, boolean bodyTruncated) {
        return new AttemptResult(ctx.requestId(), scheduleId, ctx.attempt(), timestamp, true, statusCode,
                responseTime, null, null, body, bodyTruncated, null);
    }

    public static AttemptResult statusFailure(AttemptContext ctx, String scheduleId, Instant timestamp, int statusCode,
                                              Duration responseTime, String error, byte[] body, boolean bodyTruncated) {
        return new AttemptResult(ctx.requestId(), scheduleId, ctx.attempt(), timestamp, false, statusCode,
                responseTime, ErrorKind.HTTP_STATUS, error, body, bodyTruncated, null);
    }

    public static AttemptResult transportFailure(AttemptContext ctx, String scheduleId, Instant timestamp,
                                                 Duration elapsed, String error) {
        return new AttemptResult(ctx.requestId(), scheduleId, ctx.attempt(), timestamp, false, null,
                elapsed, ErrorKind.TRANSPORT, error, null, false, null);
    }

    public AttemptResult withContentHash(String contentHash) {
        return new AttemptResult(requestId, scheduleId, attempt, timestamp, success, statusCode, responseTime,
                errorKind, error, body, bodyTruncated, contentHash);
    }

    public Long responseTimeMs() {
        return responseTime == null ? null : responseTime.toMillis();
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public String bodyAsString() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }
}
