package com.umitunal.cronlite.lease;

import java.time.Instant;

/**
 * An exclusive, time-bounded right to execute one job.
 */
public class Lease {
    private final String jobId;
    private final String holder;
    private final Instant acquiredAt;
    private volatile Instant until;

    public Lease(String jobId, String holder, Instant acquiredAt, Instant until) {
        this.jobId = jobId;
        this.holder = holder;
        this.acquiredAt = acquiredAt;
        this.until = until;
    }

    public String getJobId() { return jobId; }
    public String getHolder() { return holder; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public Instant getUntil() { return until; }

    void extendTo(Instant until) {
        this.until = until;
    }

    public boolean isExpired(Instant now) {
        return !until.isAfter(now);
    }

    @Override
    public String toString() {
        return "Lease{job='" + jobId + "', holder='" + holder + "', until=" + until + '}';
    }
}
