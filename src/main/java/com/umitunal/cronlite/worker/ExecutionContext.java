package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.lease.Lease;
import com.umitunal.cronlite.lease.LeaseManager;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What a handler sees of the run it is executing.
 */
public class ExecutionContext {
    private final Job job;
    private final int attemptNumber;
    private final Lease lease;
    private final LeaseManager leaseManager;
    private final long startedNanos;
    private volatile Instant deadline;
    private volatile long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    ExecutionContext(Job job, int attemptNumber, Lease lease, LeaseManager leaseManager,
                     Instant startedAt, Duration timeout) {
        this.job = job;
        this.attemptNumber = attemptNumber;
        this.lease = lease;
        this.leaseManager = leaseManager;
        this.startedNanos = System.nanoTime();
        this.deadline = startedAt.plus(timeout);
        this.deadlineNanos = startedNanos + timeout.toNanos();
    }

    public Job getJob() { return job; }
    public String getJobId() { return job.getId(); }
    public JobPayload getPayload() { return job.getPayload(); }

    /**
     * 1 for the first attempt of an occurrence, incremented on each retry.
     */
    public int getAttemptNumber() { return attemptNumber; }

    /**
     * When the runner gives up on the handler. Moves later with every successful
     * {@link #renewLease()}.
     */
    public Instant getDeadline() { return deadline; }
    public String getHolder() { return lease.getHolder(); }

    /**
     * True once the run timed out or lost its lease. The handler should stop as soon as it can.
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Extend the lease. A false return means another worker owns the job now; the context
     * is cancelled and the handler must abort.
     */
    public boolean renewLease() {
        if (cancelled.get()) {
            return false;
        }
        boolean renewed = leaseManager.renew(lease);
        if (!renewed) {
            cancel();
            return false;
        }
        extendDeadline(leaseManager.getLeaseDuration());
        return true;
    }

    void cancel() {
        cancelled.set(true);
    }

    /**
     * Nanoseconds left before the deadline, measured on the monotonic clock.
     */
    long remainingNanos() {
        return deadlineNanos - System.nanoTime();
    }

    /**
     * Milliseconds between the start of the run and the current deadline.
     */
    long allowedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - startedNanos);
    }

    private synchronized void extendDeadline(Duration window) {
        long candidate = System.nanoTime() + window.toNanos();
        if (candidate > deadlineNanos) {
            deadlineNanos = candidate;
        }
        if (lease.getUntil().isAfter(deadline)) {
            deadline = lease.getUntil();
        }
    }
}
