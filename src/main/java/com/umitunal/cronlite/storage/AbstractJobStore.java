package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.core.DuplicateJobException;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobMutation;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.StoreMetrics;
import com.umitunal.cronlite.core.VersionConflictException;
import com.umitunal.cronlite.model.JobRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lease and version rules shared by every backend. Each operation is a single
 * read-check-write {@link Step} that the backend runs atomically against one job.
 */
public abstract class AbstractJobStore implements JobStore {

    /**
     * Run {@code step} atomically against the current state of job {@code id}.
     * The step receives a private copy (null if the job does not exist); whatever it asks to
     * write, delete or append must become visible all at once or not at all.
     */
    protected abstract <R> R atomically(String id, Step<R> step);

    /**
     * Every stored job, in no particular order. Not part of any transaction.
     */
    protected abstract List<JobRecord> scanJobs();

    protected abstract List<ExecutionRecord> scanHistory(String jobId);

    protected abstract long countExecutions();

    @Override
    public JobRecord create(JobRecord job) {
        validateId(job.getId());
        return atomically(job.getId(), current -> {
            if (current != null) {
                throw new DuplicateJobException(job.getId());
            }
            JobRecord stored = job.copy();
            stored.setVersion(0);
            stored.clearLease();
            return StepResult.written(stored);
        });
    }

    @Override
    public Optional<JobRecord> find(String id) {
        return Optional.ofNullable(atomically(id, StepResult::read));
    }

    @Override
    public JobRecord get(String id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public List<JobRecord> list() {
        return scanJobs().stream()
                .sorted(Comparator.comparing(JobRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(JobRecord::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<JobRecord> listDue(Instant now) {
        return scanJobs().stream()
                .filter(job -> job.isDue(now))
                .sorted(Comparator.comparing(JobRecord::getNextRunAt).thenComparing(JobRecord::getId))
                .collect(Collectors.toList());
    }

    @Override
    public JobRecord update(String id, long expectedVersion, JobMutation mutation) {
        return atomically(id, current -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (current.getVersion() != expectedVersion) {
                throw new VersionConflictException(id, expectedVersion, current.getVersion());
            }
            String holder = current.getLeaseHolder();
            Instant until = current.getLeaseUntil();
            long version = current.getVersion();

            mutation.apply(current);

            // In-flight leases and identity survive any administrative edit
            current.setId(id);
            current.lease(holder, until);
            current.setVersion(version);
            return StepResult.written(current);
        });
    }

    @Override
    public boolean delete(String id) {
        return atomically(id, current -> current == null
                ? StepResult.read(false)
                : StepResult.delete(true));
    }

    @Override
    public boolean tryClaim(String id, String holder, Duration leaseDuration, long expectedVersion, Instant now) {
        return atomically(id, current -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (current.getVersion() != expectedVersion || !current.isClaimableBy(holder, now)) {
                return StepResult.read(false);
            }
            current.lease(holder, now.plus(leaseDuration));
            return StepResult.write(true, current);
        });
    }

    @Override
    public boolean renewLease(String id, String holder, Duration leaseDuration, Instant now) {
        return atomically(id, current -> {
            if (current == null || !current.isHeldBy(holder)) {
                return StepResult.read(false);
            }
            current.lease(holder, now.plus(leaseDuration));
            return StepResult.write(true, current);
        });
    }

    @Override
    public boolean releaseLease(String id, String holder) {
        return atomically(id, current -> {
            if (current == null || !current.isHeldBy(holder)) {
                return StepResult.read(false);
            }
            current.clearLease();
            return StepResult.write(true, current);
        });
    }

    @Override
    public boolean complete(String id, String holder, JobMutation mutation, ExecutionRecord record) {
        return atomically(id, current -> {
            if (current == null || !current.isHeldBy(holder)) {
                return StepResult.<Boolean>read(false).append(record);
            }
            mutation.apply(current);
            current.setId(id);
            current.clearLease();
            return StepResult.write(true, current).append(record);
        });
    }

    @Override
    public List<ExecutionRecord> history(String jobId) {
        return scanHistory(jobId).stream()
                .sorted(Comparator.comparing(ExecutionRecord::getStartedAt)
                        .thenComparingInt(ExecutionRecord::getAttemptNumber))
                .collect(Collectors.toList());
    }

    @Override
    public StoreMetrics getMetrics(Instant now) {
        long total = 0;
        long enabled = 0;
        long due = 0;
        long leased = 0;
        long failing = 0;

        for (JobRecord job : scanJobs()) {
            total++;
            if (job.isEnabled()) enabled++;
            if (job.isDue(now)) due++;
            if (job.hasActiveLease(now)) leased++;
            if (job.getLastRunStatus() == Job.RunStatus.ERROR) failing++;
        }

        return new StoreMetrics(total, enabled, due, leased, failing, countExecutions());
    }

    private static void validateId(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Job id must not be empty");
        }
        if (id.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Job id must not contain NUL characters");
        }
    }

    /**
     * One atomic read-check-write against a single job.
     */
    @FunctionalInterface
    protected interface Step<R> {
        StepResult<R> apply(JobRecord current);
    }

    /**
     * What a {@link Step} wants done. Writes always bump the version.
     */
    protected static final class StepResult<R> {
        private final R value;
        private final JobRecord write;
        private final boolean delete;
        private ExecutionRecord append;

        private StepResult(R value, JobRecord write, boolean delete) {
            this.value = value;
            this.write = write;
            this.delete = delete;
        }

        static <R> StepResult<R> read(R value) {
            return new StepResult<>(value, null, false);
        }

        static <R> StepResult<R> write(R value, JobRecord job) {
            job.incrementVersion();
            return new StepResult<>(value, job, false);
        }

        /**
         * Write {@code job} and hand the caller a copy of exactly what was stored.
         */
        static StepResult<JobRecord> written(JobRecord job) {
            job.incrementVersion();
            return new StepResult<>(job.copy(), job, false);
        }

        static <R> StepResult<R> delete(R value) {
            return new StepResult<>(value, null, true);
        }

        StepResult<R> append(ExecutionRecord record) {
            this.append = record;
            return this;
        }

        public R value() { return value; }
        public JobRecord toWrite() { return write; }
        public boolean isDelete() { return delete; }
        public ExecutionRecord toAppend() { return append; }
    }
}
