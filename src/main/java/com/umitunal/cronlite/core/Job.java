package com.umitunal.cronlite.core;

import com.umitunal.cronlite.schedule.Schedule;

import java.time.Instant;

/**
 * A persistent unit of recurring or one-shot work, together with its run summary
 * and the lease that guards its execution.
 */
public interface Job {

    /**
     * Gets the stable identifier assigned at creation.
     */
    String getId();

    /**
     * Gets the optional human label.
     */
    String getName();

    /**
     * Disabled jobs are never claimed or scheduled.
     */
    boolean isEnabled();

    Schedule getSchedule();

    JobPayload getPayload();

    /**
     * Gets the routing instruction for successful results, or null.
     */
    Delivery getDelivery();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    /**
     * Gets the next due instant, or null when the job has no future run.
     */
    Instant getNextRunAt();

    Instant getLastRunAt();

    RunStatus getLastRunStatus();

    String getLastError();

    int getConsecutiveFailures();

    /**
     * Gets the number of attempts already made in the current retry cycle (0 when none is pending).
     */
    int getCurrentAttempt();

    String getLeaseHolder();

    Instant getLeaseUntil();

    /**
     * Gets the optimistic concurrency token; changes on every stored mutation.
     */
    long getVersion();

    /**
     * Outcome of the most recent terminal run.
     */
    enum RunStatus {
        NEVER,
        SUCCESS,
        ERROR
    }
}
