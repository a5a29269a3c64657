package io.webtimer4j.history;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Totals across all schedules plus the per-schedule breakdown.
 */
public record HistorySummary(
        long total,
        long successCount,
        long failureCount,
        double successRate,
        long recent24hCount,
        List<ScheduleStats> schedules
) {

    public HistorySummary {
        schedules = List.copyOf(schedules);
    }

    public static HistorySummary compute(Collection<HistoryRecord> records, Instant now) {
        Instant dayAgo = now.minus(Duration.ofHours(24));
        long total = 0;
        long ok = 0;
        long recent = 0;
        TreeSet<String> ids = new TreeSet<>();
        for (HistoryRecord r : records) {
            total++;
            if (r.success()) {
                ok++;
            }
            if (!r.timestamp().isBefore(dayAgo)) {
                recent++;
            }
            ids.add(r.scheduleId());
        }

        List<ScheduleStats> perSchedule = new ArrayList<>(ids.size());
        for (String id : ids) {
            perSchedule.add(ScheduleStats.compute(id, records));
        }
        perSchedule.sort(Comparator.comparing(ScheduleStats::scheduleId));

        double rate = total == 0 ? 0d : (double) ok / (double) total;
        return new HistorySummary(total, ok, total - ok, rate, recent, perSchedule);
    }
}
