package io.webtimer4j;

import io.webtimer4j.core.NotificationSettings;
import io.webtimer4j.core.Schedule;
import io.webtimer4j.core.SchedulerStatus;
import io.webtimer4j.core.ScheduleUpdate;
import io.webtimer4j.history.HistoryQuery;
import io.webtimer4j.history.HistoryRecord;
import io.webtimer4j.history.HistorySummary;
import io.webtimer4j.history.ScheduleStats;

import java.util.List;

/**
 * Control surface of the scheduled-request engine.
 *
 * <p>Every call is synchronous. Registry operations surface {@code ConfigException},
 * {@code DuplicateIdException} and {@code ScheduleNotFoundException}; failures inside autonomous firings
 * are absorbed and recorded, never thrown here.
 *
 * <p>Typical usage:
 * <pre>{@code
 * webTimer.addSchedule(Schedule.builder("api_check")
 *         .url("https://example.com/health")
 *         .everySeconds(300)
 *         .retryCount(2)
 *         .build());
 * webTimer.start();
 * ...
 * webTimer.stop();
 * }</pre>
 */
public interface WebTimer {

    /**
     * Arm the timers of all enabled schedules. Idempotent.
     */
    void start();

    /**
     * Stop issuing firings and wait for in-flight firings (including their retries and history writes)
     * to complete. Idempotent.
     */
    void stop();

    boolean isRunning();

    SchedulerStatus status();

    void addSchedule(Schedule schedule);

    /**
     * Apply a partial update. A firing already in progress finishes with the previous definition.
     */
    Schedule updateSchedule(String id, ScheduleUpdate update);

    void removeSchedule(String id);

    void enable(String id);

    void disable(String id);

    /**
     * Snapshot of all schedules ordered by id.
     */
    List<Schedule> schedules();

    /**
     * Fire a schedule now, outside its timer.
     *
     * @return false if a firing of this schedule is already in flight or the engine is stopped
     */
    boolean trigger(String id);

    List<HistoryRecord> history(HistoryQuery query);

    ScheduleStats stats(String scheduleId);

    HistorySummary stats();

    /**
     * Delete history older than the configured retention.
     *
     * @return deleted count
     */
    long purgeHistory();

    NotificationSettings notificationSettings();

    void updateNotificationSettings(NotificationSettings settings);
}
