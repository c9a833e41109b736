package com.umitunal.cronlite;

import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.schedule.IntervalSchedule;
import com.umitunal.cronlite.schedule.OnceSchedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Job records for tests.
 */
public final class TestJobs {
    public static final String KIND = "test";

    private TestJobs() {
    }

    /**
     * Hourly job, due at {@code now}.
     */
    public static JobRecord dueHourly(String id, Instant now) {
        JobRecord job = new JobRecord(id, IntervalSchedule.every(Duration.ofHours(1), now),
                JobPayload.of(KIND, Map.of("n", 1)), now);
        job.setName("job " + id);
        job.setNextRunAt(now);
        return job;
    }

    public static JobRecord once(String id, Instant at, Instant now) {
        JobRecord job = new JobRecord(id, OnceSchedule.at(at), JobPayload.of(KIND), now);
        job.setNextRunAt(at);
        return job;
    }
}
