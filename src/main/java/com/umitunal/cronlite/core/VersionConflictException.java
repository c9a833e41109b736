package com.umitunal.cronlite.core;

/**
 * Thrown when a versioned update targets a job that was modified since the caller read it.
 */
public class VersionConflictException extends CronliteException {
    private final String jobId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String jobId, long expectedVersion, long actualVersion) {
        super(String.format("Version conflict on job %s: expected %d, found %d",
                jobId, expectedVersion, actualVersion));
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getJobId() { return jobId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
