package com.umitunal.cronlite.core;

import com.umitunal.cronlite.model.JobRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for jobs, their leases and their execution history.
 * <p>
 * Every mutation of a stored job goes through one of the conditional operations below;
 * nothing outside the store may read-modify-write a job record. Records returned to
 * callers are detached copies.
 * <p>
 * Infrastructure failures surface as {@link StoreUnavailableException}.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Persist a new job.
     *
     * @return the stored copy, carrying its initial version
     * @throws DuplicateJobException if the id is taken
     */
    JobRecord create(JobRecord job);

    Optional<JobRecord> find(String id);

    /**
     * @throws JobNotFoundException if the id is unknown
     */
    JobRecord get(String id);

    List<JobRecord> list();

    /**
     * Enabled jobs with {@code nextRunAt <= now}, earliest first. Leased jobs are included;
     * the claim decides whether they can run.
     */
    List<JobRecord> listDue(Instant now);

    /**
     * Apply an administrative change if the job is still at {@code expectedVersion}.
     * Lease fields are preserved whatever the mutation does.
     *
     * @return the stored copy after the change
     * @throws JobNotFoundException if the id is unknown
     * @throws VersionConflictException if the job moved on
     */
    JobRecord update(String id, long expectedVersion, JobMutation mutation);

    /**
     * @return true if a job was removed
     */
    boolean delete(String id);

    /**
     * Take or renew the execution lease. Succeeds only if, atomically, the job has no
     * active lease (or {@code holder} already owns it) and is still at {@code expectedVersion}.
     *
     * @return false if another holder won the race
     * @throws JobNotFoundException if the id is unknown
     */
    boolean tryClaim(String id, String holder, Duration leaseDuration, long expectedVersion, Instant now);

    /**
     * Extend a lease the caller still holds to {@code now + leaseDuration}.
     *
     * @return false if the lease was reassigned or the job is gone
     */
    boolean renewLease(String id, String holder, Duration leaseDuration, Instant now);

    /**
     * Clear the lease if the caller still holds it, otherwise do nothing.
     *
     * @return true if the lease was cleared
     */
    boolean releaseLease(String id, String holder);

    /**
     * Finish a run in one atomic step: append {@code record}, and, if {@code holder} still
     * holds the lease, apply {@code mutation} and release the lease.
     *
     * @return true if the job summary was updated, false if only the record was written
     */
    boolean complete(String id, String holder, JobMutation mutation, ExecutionRecord record);

    /**
     * Execution records of a job in chronological order.
     */
    List<ExecutionRecord> history(String jobId);

    StoreMetrics getMetrics(Instant now);

    @Override
    void close();
}
