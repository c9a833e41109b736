package com.umitunal.cronlite.core;

/**
 * Thrown when an operation references a job id the store does not know.
 */
public class JobNotFoundException extends CronliteException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
