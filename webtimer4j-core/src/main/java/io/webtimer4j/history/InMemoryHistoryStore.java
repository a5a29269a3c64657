package io.webtimer4j.history;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link HistoryStore}. Writes are serialized, reads share the lock.
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<HistoryRecord> records = new ArrayList<>();
    private long nextSequence = 1;

    @Override
    public HistoryRecord append(HistoryRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        lock.writeLock().lock();
        try {
            HistoryRecord stored = record.withSequence(nextSequence++);
            records.add(stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<HistoryRecord> find(HistoryQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        List<HistoryRecord> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (HistoryRecord r : records) {
                if (query.matches(r)) {
                    matched.add(r);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        matched.sort(query.ordering());
        return matched.size() > query.limit() ? List.copyOf(matched.subList(0, query.limit())) : matched;
    }

    @Override
    public ScheduleStats stats(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        return ScheduleStats.compute(scheduleId, snapshot());
    }

    @Override
    public HistorySummary summary(Instant now) {
        return HistorySummary.compute(snapshot(), now);
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        lock.writeLock().lock();
        try {
            int before = records.size();
            records.removeIf(r -> r.timestamp().isBefore(cutoff));
            return before - records.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<HistoryRecord> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }
}
