package io.webtimer4j.history;

import java.time.Instant;

/**
 * Aggregates over the stored records of one schedule.
 *
 * <p>{@code successRate} is {@code successCount / total} (0 when there are no records).
 * {@code averageResponseTimeMs} averages successful attempts only.
 */
public record ScheduleStats(
        String scheduleId,
        String scheduleName,
        long total,
        long successCount,
        long failureCount,
        double successRate,
        double averageResponseTimeMs,
        Instant lastRequestAt,
        Instant lastSuccessAt,
        Instant lastFailureAt
) {

    public static ScheduleStats empty(String scheduleId) {
        return new ScheduleStats(scheduleId, null, 0, 0, 0, 0d, 0d, null, null, null);
    }

    public static ScheduleStats compute(String scheduleId, Iterable<HistoryRecord> records) {
        String name = null;
        long total = 0;
        long ok = 0;
        long timedOk = 0;
        long responseTimeSum = 0;
        Instant lastRequest = null;
        Instant lastSuccess = null;
        Instant lastFailure = null;

        for (HistoryRecord r : records) {
            if (!scheduleId.equals(r.scheduleId())) {
                continue;
            }
            total++;
            if (lastRequest == null || r.timestamp().isAfter(lastRequest)) {
                lastRequest = r.timestamp();
                name = r.scheduleName();
            }
            if (r.success()) {
                ok++;
                if (r.responseTimeMs() != null) {
                    timedOk++;
                    responseTimeSum += r.responseTimeMs();
                }
                lastSuccess = later(lastSuccess, r.timestamp());
            } else {
                lastFailure = later(lastFailure, r.timestamp());
            }
        }

        if (total == 0) {
            return empty(scheduleId);
        }
        double rate = (double) ok / (double) total;
        double avg = timedOk == 0 ? 0d : (double) responseTimeSum / (double) timedOk;
        return new ScheduleStats(scheduleId, name, total, ok, total - ok, rate, avg,
                lastRequest, lastSuccess, lastFailure);
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) return b;
        return b.isAfter(a) ? b : a;
    }
}
