package io.webtimer4j.core;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable per-schedule state owned by the scheduler.
 *
 * <p>The in-flight flag is the per-job mutex: only the thread that won {@link #tryBeginFiring(Instant)}
 * mutates hash and outcome fields until it calls {@link #endFiring()}. Other fields are read concurrently by
 * status queries.
 */
public final class JobRuntimeState {

    private final String scheduleId;
    private final AtomicBoolean inFlight;
    private final AtomicLong generation = new AtomicLong();

    private volatile String lastHash;
    private volatile Boolean lastSuccess;
    private volatile boolean consecutiveFailure;
    private volatile String lastError;
    private volatile Instant nextDueAt;
    private volatile Instant lastRunAt;

    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong skippedCount = new AtomicLong();

    public JobRuntimeState(String scheduleId) {
        this(scheduleId, new AtomicBoolean(false));
    }

    private JobRuntimeState(String scheduleId, AtomicBoolean inFlight) {
        this.scheduleId = scheduleId;
        this.inFlight = inFlight;
    }

    /**
     * Fresh state for a schedule re-added under the same id. It shares the in-flight flag of the state it
     * replaces, so a firing still running for the removed definition keeps the new one from starting.
     */
    public static JobRuntimeState successorOf(JobRuntimeState previous) {
        return new JobRuntimeState(previous.scheduleId, previous.inFlight);
    }

    public String scheduleId() {
        return scheduleId;
    }

    /**
     * Claim the schedule for one firing. False means a firing is already in flight.
     */
    public boolean tryBeginFiring(Instant now) {
        if (!inFlight.compareAndSet(false, true)) {
            return false;
        }
        lastRunAt = now;
        return true;
    }

    public void endFiring() {
        inFlight.set(false);
    }

    public boolean inFlight() {
        return inFlight.get();
    }

    /**
     * Invalidate any armed timer and return the token for the next one.
     */
    public long nextGeneration() {
        return generation.incrementAndGet();
    }

    public long generation() {
        return generation.get();
    }

    public String lastHash() {
        return lastHash;
    }

    /**
     * Only called for successful attempts; failures keep the last successful hash.
     */
    public void updateLastHash(String hash) {
        this.lastHash = hash;
    }

    public boolean consecutiveFailure() {
        return consecutiveFailure;
    }

    public String lastError() {
        return lastError;
    }

    public Boolean lastSuccess() {
        return lastSuccess;
    }

    public void recordOutcome(NotificationType type, String error) {
        runCount.incrementAndGet();
        if (type.successClass()) {
            lastSuccess = Boolean.TRUE;
            consecutiveFailure = false;
            lastError = null;
        } else {
            lastSuccess = Boolean.FALSE;
            consecutiveFailure = true;
            lastError = error;
            errorCount.incrementAndGet();
        }
    }

    public void recordSkipped() {
        skippedCount.incrementAndGet();
    }

    public Instant nextDueAt() {
        return nextDueAt;
    }

    public void nextDueAt(Instant nextDueAt) {
        this.nextDueAt = nextDueAt;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public long runCount() {
        return runCount.get();
    }

    public long errorCount() {
        return errorCount.get();
    }

    public long skippedCount() {
        return skippedCount.get();
    }

    public JobState state(boolean enabled, boolean schedulerRunning, Instant now) {
        if (!enabled) {
            return JobState.DISABLED;
        }
        if (inFlight.get()) {
            return JobState.EXECUTING;
        }
        Instant due = nextDueAt;
        if (schedulerRunning && due != null && !due.isAfter(now)) {
            return JobState.DUE;
        }
        return JobState.IDLE;
    }
}
