package com.umitunal.cronlite.core;

/**
 * Point-in-time counts over the job store.
 */
public class StoreMetrics {
    private final long totalJobs;
    private final long enabledJobs;
    private final long dueJobs;
    private final long leasedJobs;
    private final long failingJobs;
    private final long executionRecords;

    public StoreMetrics(long totalJobs, long enabledJobs, long dueJobs,
                        long leasedJobs, long failingJobs, long executionRecords) {
        this.totalJobs = totalJobs;
        this.enabledJobs = enabledJobs;
        this.dueJobs = dueJobs;
        this.leasedJobs = leasedJobs;
        this.failingJobs = failingJobs;
        this.executionRecords = executionRecords;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getEnabledJobs() { return enabledJobs; }
    public long getDueJobs() { return dueJobs; }
    public long getLeasedJobs() { return leasedJobs; }
    public long getFailingJobs() { return failingJobs; }
    public long getExecutionRecords() { return executionRecords; }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, enabled=%d, due=%d, leased=%d, failing=%d, executions=%d}",
            totalJobs, enabledJobs, dueJobs, leasedJobs, failingJobs, executionRecords
        );
    }
}
