package io.webtimer4j.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory table of schedule definitions, keyed and ordered by id.
 *
 * <p>Every mutation validates the resulting definition and swaps in a new immutable {@link Schedule}, so a
 * firing that already captured the previous instance is unaffected.
 */
public class ScheduleRegistry {

    private final TreeMap<String, Schedule> schedules = new TreeMap<>();

    public synchronized Schedule add(Schedule schedule) {
        ScheduleValidator.validate(schedule);
        if (schedules.containsKey(schedule.id())) {
            throw new DuplicateIdException(schedule.id());
        }
        schedules.put(schedule.id(), schedule);
        return schedule;
    }

    public synchronized Schedule update(String id, ScheduleUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        Schedule updated = ScheduleValidator.validate(update.applyTo(getRequired(id)));
        schedules.put(id, updated);
        return updated;
    }

    public synchronized Schedule remove(String id) {
        Schedule removed = schedules.remove(id);
        if (removed == null) {
            throw new ScheduleNotFoundException(id);
        }
        return removed;
    }

    public synchronized Schedule setEnabled(String id, boolean enabled) {
        Schedule current = getRequired(id);
        if (current.enabled() == enabled) {
            return current;
        }
        Schedule toggled = current.withEnabled(enabled);
        schedules.put(id, toggled);
        return toggled;
    }

    public synchronized Optional<Schedule> find(String id) {
        return Optional.ofNullable(id == null ? null : schedules.get(id));
    }

    public synchronized Schedule getRequired(String id) {
        Schedule schedule = id == null ? null : schedules.get(id);
        if (schedule == null) {
            throw new ScheduleNotFoundException(id);
        }
        return schedule;
    }

    /**
     * Snapshot ordered by id; later mutations do not show through.
     */
    public synchronized List<Schedule> list() {
        return List.copyOf(schedules.values());
    }

    public synchronized int size() {
        return schedules.size();
    }
}
