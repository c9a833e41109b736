package com.umitunal.cronlite.admin;

import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Create, edit, enable, disable and delete jobs.
 * <p>
 * Every edit is a versioned store update, so an edit based on a stale read fails with
 * {@link com.umitunal.cronlite.core.VersionConflictException} instead of overwriting a
 * concurrent run's summary. Leases held by running executions are never touched.
 */
public class JobAdminService {
    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final List<JobChangeListener> listeners = new CopyOnWriteArrayList<>();

    public JobAdminService(JobStore store, ScheduleCalculator calculator, Clock clock) {
        this.store = store;
        this.calculator = calculator;
        this.clock = clock;
    }

    public void addListener(JobChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * @throws com.umitunal.cronlite.core.InvalidScheduleException if the schedule cannot be evaluated
     */
    public JobRecord create(JobSpec spec) {
        calculator.validate(spec.getSchedule());
        Instant now = clock.instant();

        JobRecord job = new JobRecord(JobRecord.newId(), spec.getSchedule(), spec.getPayload(), now);
        job.setName(spec.getName());
        job.setEnabled(spec.isEnabled());
        job.setDelivery(spec.getDelivery());
        job.setNextRunAt(spec.isEnabled()
                ? calculator.initialRunAt(spec.getSchedule(), now).orElse(null)
                : null);

        JobRecord stored = store.create(job);
        log.info("Created job {} ({}) {} next run {}", stored.getId(), stored.getName(),
                stored.getSchedule(), stored.getNextRunAt());
        notifyChanged(stored);
        return stored;
    }

    /**
     * Replace the editable fields. The next run is recomputed, and a pending retry dropped,
     * only when the schedule or the enabled flag changed.
     */
    public JobRecord update(String id, long expectedVersion, JobSpec spec) {
        calculator.validate(spec.getSchedule());
        Instant now = clock.instant();

        JobRecord stored = store.update(id, expectedVersion, current -> {
            boolean scheduleChanged = !Objects.equals(current.getSchedule(), spec.getSchedule());
            boolean timingChanged = scheduleChanged || current.isEnabled() != spec.isEnabled();

            current.setName(spec.getName());
            current.setEnabled(spec.isEnabled());
            current.setSchedule(spec.getSchedule());
            current.setPayload(spec.getPayload());
            current.setDelivery(spec.getDelivery());
            current.setUpdatedAt(now);
            if (timingChanged) {
                reschedule(current, now, scheduleChanged);
            }
        });

        log.info("Updated job {} to version {}", id, stored.getVersion());
        notifyChanged(stored);
        return stored;
    }

    public JobRecord setEnabled(String id, long expectedVersion, boolean enabled) {
        Instant now = clock.instant();

        JobRecord stored = store.update(id, expectedVersion, current -> {
            if (current.isEnabled() == enabled) {
                return;
            }
            current.setEnabled(enabled);
            current.setUpdatedAt(now);
            if (enabled) {
                current.setConsecutiveFailures(0);
            }
            reschedule(current, now, false);
        });

        log.info("Job {} {}", id, enabled ? "enabled" : "disabled");
        notifyChanged(stored);
        return stored;
    }

    /**
     * Remove a job. An execution already running finishes, but its result is not applied.
     *
     * @return false if there was no such job
     */
    public boolean delete(String id) {
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("Deleted job {}", id);
            for (JobChangeListener listener : listeners) {
                try {
                    listener.jobDeleted(id);
                } catch (RuntimeException e) {
                    log.warn("Listener {} failed on delete of job {}: {}", listener, id, e.toString());
                }
            }
        }
        return deleted;
    }

    public JobRecord get(String id) {
        return store.get(id);
    }

    public List<JobRecord> list() {
        return store.list();
    }

    public List<ExecutionRecord> history(String id) {
        return store.history(id);
    }

    /**
     * A past one-shot is due immediately only while it has never run; once fired it stays
     * spent until it is given a different schedule.
     */
    private void reschedule(JobRecord job, Instant now, boolean scheduleChanged) {
        job.setCurrentAttempt(0);
        if (!job.isEnabled()) {
            job.setNextRunAt(null);
            return;
        }
        boolean fired = job.getLastRunStatus() != Job.RunStatus.NEVER && !scheduleChanged;
        job.setNextRunAt((fired
                ? calculator.nextRunAt(job.getSchedule(), now)
                : calculator.initialRunAt(job.getSchedule(), now)).orElse(null));
    }

    private void notifyChanged(JobRecord job) {
        for (JobChangeListener listener : listeners) {
            try {
                listener.jobChanged(job);
            } catch (RuntimeException e) {
                // The store already holds the change; listeners only cache it
                log.warn("Listener {} failed on change of job {}: {}", listener, job.getId(), e.toString());
            }
        }
    }
}
