package io.webtimer4j.history;

import java.time.Instant;
import java.util.Comparator;

/**
 * Filter for listing history. Every selector is optional; results are newest-first unless
 * {@link Builder#oldestFirst()} is set.
 *
 * <p>This is an API-layer object; each store translates it into its own query.
 */
public final class HistoryQuery {

    public static final int DEFAULT_LIMIT = 100;

    /** Newest first, ties broken by descending sequence. */
    public static final Comparator<HistoryRecord> NEWEST_FIRST = Comparator
            .comparing(HistoryRecord::timestamp)
            .thenComparing(r -> r.sequence() == null ? Long.MIN_VALUE : r.sequence())
            .reversed();

    private final String scheduleId;
    private final Boolean success;
    private final Instant from;
    private final Instant to;
    private final int limit;
    private final boolean oldestFirst;

    private HistoryQuery(Builder b) {
        this.scheduleId = (b.scheduleId == null || b.scheduleId.isBlank()) ? null : b.scheduleId;
        this.success = b.success;
        this.from = b.from;
        this.to = b.to;
        this.limit = b.limit;
        this.oldestFirst = b.oldestFirst;
    }

    public static HistoryQuery all() {
        return builder().build();
    }

    public static HistoryQuery forSchedule(String scheduleId) {
        return builder().scheduleId(scheduleId).build();
    }

    public String scheduleId() {
        return scheduleId;
    }

    /**
     * Success flag filter; null matches both.
     */
    public Boolean success() {
        return success;
    }

    /**
     * Inclusive lower bound on the attempt timestamp.
     */
    public Instant from() {
        return from;
    }

    /**
     * Inclusive upper bound on the attempt timestamp.
     */
    public Instant to() {
        return to;
    }

    public int limit() {
        return limit;
    }

    public boolean oldestFirst() {
        return oldestFirst;
    }

    public Comparator<HistoryRecord> ordering() {
        return oldestFirst ? NEWEST_FIRST.reversed() : NEWEST_FIRST;
    }

    public boolean matches(HistoryRecord r) {
        if (scheduleId != null && !scheduleId.equals(r.scheduleId())) {
            return false;
        }
        if (success != null && success != r.success()) {
            return false;
        }
        if (from != null && r.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || !r.timestamp().isAfter(to);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String scheduleId;
        private Boolean success;
        private Instant from;
        private Instant to;
        private int limit = DEFAULT_LIMIT;
        private boolean oldestFirst;

        public Builder scheduleId(String scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder success(Boolean success) {
            this.success = success;
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        /**
         * Max rows returned; {@code Integer.MAX_VALUE} for no limit.
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder oldestFirst() {
            this.oldestFirst = true;
            return this;
        }

        public HistoryQuery build() {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be a positive number");
            }
            if (from != null && to != null && from.isAfter(to)) {
                throw new IllegalArgumentException("from must not be after to");
            }
            return new HistoryQuery(this);
        }
    }
}
