package io.webtimer4j.internal;

import io.webtimer4j.NotificationDispatcher;
import io.webtimer4j.RequestExecutor;
import io.webtimer4j.WebTimer;
import io.webtimer4j.config.WebTimerProperties;
import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.ChangeDetector;
import io.webtimer4j.core.ChangeResult;
import io.webtimer4j.core.FiringResult;
import io.webtimer4j.core.JobRuntimeState;
import io.webtimer4j.core.JobStatus;
import io.webtimer4j.core.NotificationClassifier;
import io.webtimer4j.core.NotificationEvent;
import io.webtimer4j.core.NotificationSettings;
import io.webtimer4j.core.NotificationType;
import io.webtimer4j.core.PersistenceException;
import io.webtimer4j.core.RetryController;
import io.webtimer4j.core.Schedule;
import io.webtimer4j.core.ScheduleRegistry;
import io.webtimer4j.core.ScheduleUpdate;
import io.webtimer4j.core.SchedulerStatus;
import io.webtimer4j.core.Trigger;
import io.webtimer4j.core.TriggerKind;
import io.webtimer4j.history.HistoryQuery;
import io.webtimer4j.history.HistoryRecord;
import io.webtimer4j.history.HistoryStore;
import io.webtimer4j.history.HistorySummary;
import io.webtimer4j.history.ScheduleStats;
import io.webtimer4j.utils.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduled HTTP request engine.
 *
 * <p>Each enabled schedule has exactly one armed {@link DueEntry} in a {@link DelayQueue}. The dispatcher
 * thread takes due entries, re-arms the next one and hands the firing to the worker pool. A firing runs the
 * retry sequence, change detection, history writes and classification, then dispatches the notification.
 *
 * <p>Typical usage:
 * <pre>{@code
 * WebTimer timer = new DefaultWebTimer(props, executor, historyStore, dispatcher);
 * timer.addSchedule(Schedule.builder("api_check").url("https://example.com").everySeconds(300).build());
 * timer.start();
 * ...
 * timer.stop();
 * }</pre>
 */
public class DefaultWebTimer implements WebTimer {
    private static final Logger log = LoggerFactory.getLogger(DefaultWebTimer.class);

    private final WebTimerProperties props;
    private final ScheduleRegistry registry = new ScheduleRegistry();
    private final HistoryStore historyStore;
    private final NotificationDispatcher dispatcher;

    private final RetryController retryController;
    private final ChangeDetector changeDetector;
    private final NotificationClassifier classifier = new NotificationClassifier();

    private final ConcurrentHashMap<String, JobRuntimeState> states = new ConcurrentHashMap<>();
    // states of removed schedules whose firing is still running
    private final ConcurrentHashMap<String, JobRuntimeState> retired = new ConcurrentHashMap<>();
    private final AtomicReference<NotificationSettings> notificationSettings;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final DelayQueue<DueEntry> queue = new DelayQueue<>();

    private volatile ExecutorService workerPool;
    private Thread dispatcherThread;

    /**
     * Armed timer of one schedule. Entries whose state was replaced or whose generation no longer matches are
     * stale and ignored when they come due.
     */
    private static final class DueEntry implements Delayed {
        private final String scheduleId;
        private final JobRuntimeState state;
        private final Instant dueAt;
        private final long generation;

        private DueEntry(JobRuntimeState state, Instant dueAt, long generation) {
            this.scheduleId = state.scheduleId();
            this.state = state;
            this.dueAt = dueAt;
            this.generation = generation;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(Instant.now(), dueAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DueEntry o) {
                return this.dueAt.compareTo(o.dueAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public DefaultWebTimer(WebTimerProperties props,
                           RequestExecutor executor,
                           HistoryStore historyStore,
                           NotificationDispatcher dispatcher) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.retryController = new RetryController(
                Objects.requireNonNull(executor, "executor must not be null"), props.toRequestDefaults());
        this.changeDetector = new ChangeDetector(new ContentHasher(props.getHistory().getMaxHashedBytes()));
        this.notificationSettings = new AtomicReference<>(props.toNotificationSettings());
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        if (props.getMaxConcurrency() <= 0) {
            started.set(false);
            throw new IllegalArgumentException("webtimer.maxConcurrency must be a positive number");
        }

        try {
            historyStore.initialize();
        } catch (RuntimeException e) {
            started.set(false);
            log.error("WebTimer failed to initialize history store msg={}", e.getMessage(), e);
            throw e;
        }

        log.info("WebTimer starting with schedules={}, maxConcurrency={}, notifications={}",
                registry.size(), props.getMaxConcurrency(), notificationSettings.get().enabled());

        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("webtimer.worker");
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("webtimer.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        for (Schedule schedule : registry.list()) {
            if (schedule.enabled()) {
                arm(schedule, stateFor(schedule.id()), true);
            }
        }
        log.info("WebTimer started successfully.");
    }

    /**
     * Stop arming timers and wait up to {@code shutdownTimeout} for in-flight firings, retries included.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("WebTimer stopping...");

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }
        queue.clear();
        states.values().forEach(this::disarm);

        ExecutorService pool = workerPool;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("WebTimer in-flight firings did not finish within {}; interrupting", props.getShutdownTimeout());
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        log.info("WebTimer stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public SchedulerStatus status() {
        boolean running = started.get();
        Instant now = nowInstant();
        List<JobStatus> jobs = new ArrayList<>();
        int executing = 0;
        for (Schedule schedule : registry.list()) {
            JobRuntimeState state = stateFor(schedule.id());
            if (state.inFlight()) {
                executing++;
            }
            boolean armed = running && schedule.enabled();
            jobs.add(new JobStatus(
                    schedule.id(),
                    schedule.name(),
                    schedule.enabled(),
                    state.state(schedule.enabled(), running, now),
                    schedule.trigger().describe(),
                    armed ? state.nextDueAt() : null,
                    state.lastRunAt(),
                    state.lastSuccess(),
                    state.consecutiveFailure(),
                    state.runCount(),
                    state.errorCount(),
                    state.skippedCount()
            ));
        }
        return new SchedulerStatus(running, jobs.size(), executing, jobs);
    }

    @Override
    public void addSchedule(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Schedule added = registry.add(withDefaultTimezone(schedule));
        JobRuntimeState previous = retired.remove(added.id());
        JobRuntimeState state = previous == null
                ? new JobRuntimeState(added.id())
                : JobRuntimeState.successorOf(previous);
        states.put(added.id(), state);
        if (started.get() && added.enabled()) {
            arm(added, state, true);
        }
        log.info("WebTimer schedule added id={} trigger={} enabled={}", added.id(), added.trigger().describe(), added.enabled());
    }

    @Override
    public Schedule updateSchedule(String id, ScheduleUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        ScheduleUpdate effective = update;
        Trigger trigger = update.trigger();
        if (trigger != null && trigger.kind() == TriggerKind.CRON && trigger.timezone() == null
                && props.getDefaultTimezone() != null) {
            effective = update.withTrigger(trigger.withTimezone(props.getDefaultTimezone()));
        }

        Schedule current = registry.getRequired(id);
        Schedule updated = registry.update(id, effective);
        if (effective.affectsTiming(current)) {
            JobRuntimeState state = stateFor(id);
            if (updated.enabled() && started.get()) {
                arm(updated, state, false);
            } else {
                disarm(state);
            }
        }
        log.info("WebTimer schedule updated id={} trigger={} enabled={}", id, updated.trigger().describe(), updated.enabled());
        return updated;
    }

    @Override
    public void removeSchedule(String id) {
        registry.remove(id);
        JobRuntimeState state = states.remove(id);
        if (state != null) {
            disarm(state);
            if (state.inFlight()) {
                retired.put(id, state);
            }
        }
        log.info("WebTimer schedule removed id={}", id);
    }

    @Override
    public void enable(String id) {
        boolean wasEnabled = registry.getRequired(id).enabled();
        Schedule schedule = registry.setEnabled(id, true);
        if (!wasEnabled && started.get()) {
            arm(schedule, stateFor(id), false);
        }
        log.info("WebTimer schedule enabled id={}", id);
    }

    @Override
    public void disable(String id) {
        registry.setEnabled(id, false);
        disarm(stateFor(id));
        log.info("WebTimer schedule disabled id={}", id);
    }

    @Override
    public List<Schedule> schedules() {
        return registry.list();
    }

    @Override
    public boolean trigger(String id) {
        Schedule schedule = registry.getRequired(id);
        if (!started.get()) {
            log.warn("WebTimer trigger ignored, engine is stopped id={}", id);
            return false;
        }
        JobRuntimeState state = states.get(id);
        if (state == null || !state.tryBeginFiring(nowInstant())) {
            log.warn("WebTimer trigger ignored, firing already in flight id={}", id);
            return false;
        }
        log.info("WebTimer manual firing id={}", id);
        return submit(schedule, state);
    }

    @Override
    public List<HistoryRecord> history(HistoryQuery query) {
        return historyStore.find(query == null ? HistoryQuery.all() : query);
    }

    @Override
    public ScheduleStats stats(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        return historyStore.stats(scheduleId);
    }

    @Override
    public HistorySummary stats() {
        return historyStore.summary(nowInstant());
    }

    @Override
    public long purgeHistory() {
        Instant cutoff = nowInstant().minus(props.getHistory().getRetention());
        long deleted = historyStore.purgeOlderThan(cutoff);
        log.info("WebTimer history purged cutoff={} deleted={}", cutoff, deleted);
        return deleted;
    }

    @Override
    public NotificationSettings notificationSettings() {
        return notificationSettings.get();
    }

    @Override
    public void updateNotificationSettings(NotificationSettings settings) {
        notificationSettings.set(Objects.requireNonNull(settings, "settings must not be null"));
        log.info("WebTimer notification settings updated enabled={} target={}:{}",
                settings.enabled(), settings.serverAddress(), settings.port());
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private JobRuntimeState stateFor(String id) {
        return states.computeIfAbsent(id, JobRuntimeState::new);
    }

    private Schedule withDefaultTimezone(Schedule schedule) {
        Trigger trigger = schedule.trigger();
        if (trigger != null && trigger.kind() == TriggerKind.CRON && trigger.timezone() == null
                && props.getDefaultTimezone() != null) {
            return schedule.toBuilder().trigger(trigger.withTimezone(props.getDefaultTimezone())).build();
        }
        return schedule;
    }

    private void arm(Schedule schedule, JobRuntimeState state, boolean initial) {
        long generation = state.nextGeneration();
        Instant now = nowInstant();
        Instant dueAt = (initial && schedule.runImmediately())
                ? now
                : schedule.trigger().nextDue(null, now);
        state.nextDueAt(dueAt);
        queue.offer(new DueEntry(state, dueAt, generation));
        log.debug("WebTimer armed id={} dueAt={}", schedule.id(), dueAt);
    }

    private void disarm(JobRuntimeState state) {
        state.nextGeneration();
        state.nextDueAt(null);
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                onDue(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("webtimer dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void onDue(DueEntry entry) {
        JobRuntimeState state = entry.state;
        if (states.get(entry.scheduleId) != state || state.generation() != entry.generation) {
            return;
        }
        Optional<Schedule> found = registry.find(entry.scheduleId);
        if (found.isEmpty() || !found.get().enabled()) {
            return;
        }
        Schedule schedule = found.get();

        Instant now = nowInstant();
        Instant next = schedule.trigger().nextDue(entry.dueAt, now);
        state.nextDueAt(next);
        queue.offer(new DueEntry(state, next, entry.generation));

        if (!state.tryBeginFiring(now)) {
            state.recordSkipped();
            log.warn("webtimer firing skipped, previous firing still in flight id={} dueAt={}", schedule.id(), entry.dueAt);
            return;
        }
        submit(schedule, state);
    }

    private boolean submit(Schedule schedule, JobRuntimeState state) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            state.endFiring();
            return false;
        }
        try {
            pool.submit(() -> runFiring(schedule, state));
            return true;
        } catch (RejectedExecutionException e) {
            state.endFiring();
            log.warn("webtimer firing rejected, engine is stopping id={}", schedule.id());
            return false;
        }
    }

    /**
     * One firing: retry sequence, change detection, history, classification, notification. Runs on a worker
     * thread that already owns the schedule's in-flight flag.
     */
    void runFiring(Schedule schedule, JobRuntimeState state) {
        try {
            String requestId = UUID.randomUUID().toString();
            log.debug("webtimer firing started id={} requestId={}", schedule.id(), requestId);

            FiringResult firing = retryController.run(schedule, requestId);

            boolean wasFailing = state.consecutiveFailure();
            String previousError = state.lastError();

            ChangeResult change = changeDetector.detect(firing.finalAttempt(), state);
            if (change.currentHash() != null) {
                firing = firing.withFinalAttempt(firing.finalAttempt().withContentHash(change.currentHash()));
            }
            AttemptResult last = firing.finalAttempt();

            appendHistory(schedule, firing);

            NotificationType type = classifier.classify(last, change, wasFailing);
            state.recordOutcome(type, last.error());
            log.info("webtimer firing finished id={} requestId={} outcome={} attempts={} status={}",
                    schedule.id(), requestId, type.wireName(), firing.attempts().size(), last.statusCode());

            NotificationSettings settings = notificationSettings.get();
            if (classifier.shouldEmit(type, settings, wasFailing, previousError, last.error())) {
                try {
                    dispatcher.dispatch(new NotificationEvent(type, schedule, last, change, nowInstant()), settings);
                } catch (RuntimeException e) {
                    log.error("webtimer notification dispatch failed id={} type={} msg={}",
                            schedule.id(), type.wireName(), e.getMessage(), e);
                }
            }
        } catch (RuntimeException e) {
            log.error("webtimer firing failed id={} msg={}", schedule.id(), e.getMessage(), e);
        } finally {
            state.endFiring();
            retired.remove(schedule.id(), state);
        }
    }

    private void appendHistory(Schedule schedule, FiringResult firing) {
        int maxStored = props.getHistory().getMaxStoredBodyBytes();
        for (AttemptResult attempt : firing.attempts()) {
            try {
                historyStore.append(HistoryRecord.of(schedule, attempt, maxStored));
            } catch (PersistenceException e) {
                log.error("webtimer history append failed id={} requestId={} attempt={} msg={}",
                        schedule.id(), attempt.requestId(), attempt.attempt(), e.getMessage(), e);
            }
        }
    }
}
