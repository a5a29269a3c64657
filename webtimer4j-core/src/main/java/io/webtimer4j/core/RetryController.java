package io.webtimer4j.core;

import io.webtimer4j.RequestExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs up to {@code retryCount + 1} attempts with a fixed delay between them, stopping at the first success.
 */
public class RetryController {
    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final RequestExecutor executor;
    private final RequestDefaults defaults;

    public RetryController(RequestExecutor executor, RequestDefaults defaults) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    public FiringResult run(Schedule schedule, String requestId) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");

        int retries = defaults.retryCountFor(schedule);
        Duration delay = defaults.retryDelayFor(schedule);
        Duration timeout = defaults.timeoutFor(schedule);
        int maxAttempts = retries + 1;

        List<AttemptResult> attempts = new ArrayList<>(Math.min(maxAttempts, 16));
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AttemptResult result = executeGuarded(schedule, new AttemptContext(requestId, attempt, timeout));
            attempts.add(result);

            if (result.success()) {
                log.debug("request succeeded id={} attempt={}/{} status={}",
                        schedule.id(), attempt, maxAttempts, result.statusCode());
                break;
            }

            log.warn("request failed id={} attempt={}/{} error={}",
                    schedule.id(), attempt, maxAttempts, result.error());

            if (attempt < maxAttempts && !pause(delay)) {
                log.warn("retry sequence interrupted id={} after attempt={}", schedule.id(), attempt);
                break;
            }
        }
        return new FiringResult(attempts);
    }

    private AttemptResult executeGuarded(Schedule schedule, AttemptContext ctx) {
        Instant started = Instant.now();
        try {
            return executor.execute(schedule, ctx);
        } catch (RuntimeException e) {
            log.error("request executor threw id={} attempt={} msg={}", schedule.id(), ctx.attempt(), e.getMessage(), e);
            return AttemptResult.transportFailure(ctx, schedule.id(), started,
                    Duration.between(started, Instant.now()), String.valueOf(e.getMessage()));
        }
    }

    /**
     * Wait between attempts. Returns false if the wait was interrupted.
     */
    protected boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
