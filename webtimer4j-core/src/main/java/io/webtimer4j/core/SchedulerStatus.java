package io.webtimer4j.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SchedulerStatus(
        boolean running,
        int jobCount,
        int runningJobs,
        List<JobStatus> jobs
) {

    public SchedulerStatus {
        jobs = List.copyOf(jobs);
    }

    /**
     * Next due time per schedule id; disabled schedules and stopped engines map to null.
     */
    public Map<String, Instant> nextDueTimes() {
        Map<String, Instant> out = new LinkedHashMap<>();
        for (JobStatus job : jobs) {
            out.put(job.id(), job.nextDueAt());
        }
        return out;
    }
}
