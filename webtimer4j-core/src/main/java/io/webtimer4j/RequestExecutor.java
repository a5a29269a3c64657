package io.webtimer4j;

import io.webtimer4j.core.AttemptContext;
import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.Schedule;

/**
 * Performs a single HTTP attempt.
 *
 * <p>Implementations bound the attempt by {@link AttemptContext#timeout()} and report timeouts, transport
 * errors and non-success statuses as a failed {@link AttemptResult} instead of throwing.
 */
public interface RequestExecutor {

    AttemptResult execute(Schedule schedule, AttemptContext context);
}
