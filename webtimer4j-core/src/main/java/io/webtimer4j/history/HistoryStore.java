package io.webtimer4j.history;

import io.webtimer4j.core.PersistenceException;

import java.time.Instant;
import java.util.List;

/**
 * Append-only attempt history.
 *
 * <p>Implementations must accept concurrent appends from different schedules, each append being atomic,
 * and must let queries run while appends are in progress.
 */
public interface HistoryStore {

    /**
     * Prepare the storage. Called once by {@code start()}; a failure prevents the engine from starting.
     */
    default void initialize() throws PersistenceException {
    }

    /**
     * Persist one record and return it with its assigned sequence.
     *
     * @throws PersistenceException on storage I/O failure
     */
    HistoryRecord append(HistoryRecord record) throws PersistenceException;

    List<HistoryRecord> find(HistoryQuery query) throws PersistenceException;

    /**
     * Aggregates for one schedule, computed from the stored records.
     */
    ScheduleStats stats(String scheduleId) throws PersistenceException;

    HistorySummary summary(Instant now) throws PersistenceException;

    /**
     * Delete records strictly older than {@code cutoff}.
     *
     * @return deleted count
     */
    long purgeOlderThan(Instant cutoff) throws PersistenceException;
}
