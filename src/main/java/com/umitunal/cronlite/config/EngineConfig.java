package com.umitunal.cronlite.config;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Runtime settings of a scheduler worker: leases, retries, pools and cadence.
 */
public class EngineConfig {
    private final String workerId;
    private final Duration leaseDuration;
    private final Duration executionTimeout;
    private final int maxAttempts;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final int autoDisableThreshold;
    private final int executionThreads;
    private final int maxConcurrentRuns;
    private final int storeRetryAttempts;
    private final Duration storeRetryBackoff;
    private final Duration tickInterval;

    private EngineConfig(Builder builder) {
        this.workerId = builder.workerId;
        this.leaseDuration = builder.leaseDuration;
        this.executionTimeout = builder.executionTimeout;
        this.maxAttempts = builder.maxAttempts;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.autoDisableThreshold = builder.autoDisableThreshold;
        this.executionThreads = builder.executionThreads;
        this.maxConcurrentRuns = Math.max(builder.maxConcurrentRuns, builder.executionThreads);
        this.storeRetryAttempts = builder.storeRetryAttempts;
        this.storeRetryBackoff = builder.storeRetryBackoff;
        this.tickInterval = builder.tickInterval;
    }

    public String getWorkerId() { return workerId; }
    public Duration getLeaseDuration() { return leaseDuration; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public Duration getRetryMaxDelay() { return retryMaxDelay; }
    public int getAutoDisableThreshold() { return autoDisableThreshold; }
    public int getExecutionThreads() { return executionThreads; }
    public int getMaxConcurrentRuns() { return maxConcurrentRuns; }
    public int getStoreRetryAttempts() { return storeRetryAttempts; }
    public Duration getStoreRetryBackoff() { return storeRetryBackoff; }
    public Duration getTickInterval() { return tickInterval; }

    /**
     * Deadline for one handler invocation; the lease duration unless set explicitly.
     */
    public Duration getExecutionTimeout() {
        return executionTimeout == null ? leaseDuration : executionTimeout;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        return "EngineConfig{workerId='" + workerId + "', lease=" + leaseDuration
                + ", timeout=" + getExecutionTimeout() + ", maxAttempts=" + maxAttempts
                + ", retryBase=" + retryBaseDelay + ", retryMax=" + retryMaxDelay
                + ", autoDisable=" + autoDisableThreshold + ", threads=" + executionThreads
                + ", maxRuns=" + maxConcurrentRuns
                + ", tick=" + tickInterval + '}';
    }

    static String defaultWorkerId() {
        // "pid@hostname" on HotSpot
        return ManagementFactory.getRuntimeMXBean().getName();
    }

    public static class Builder {
        private String workerId = defaultWorkerId();
        private Duration leaseDuration = Duration.ofMinutes(5);
        private Duration executionTimeout;
        private int maxAttempts = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(30);
        private Duration retryMaxDelay = Duration.ofMinutes(15);
        private int autoDisableThreshold = 0;
        private int executionThreads = 4;
        private int maxConcurrentRuns = 64;
        private int storeRetryAttempts = 3;
        private Duration storeRetryBackoff = Duration.ofMillis(200);
        private Duration tickInterval = Duration.ofSeconds(60);

        private Builder() {
        }

        /**
         * Prefix of every lease holder id issued by this worker.
         * Default: pid@hostname
         */
        public Builder withWorkerId(String workerId) {
            if (workerId == null || workerId.trim().isEmpty()) {
                throw new IllegalArgumentException("Worker id must not be empty");
            }
            this.workerId = workerId;
            return this;
        }

        /**
         * How long a claim stays exclusive without renewal.
         * Should be about three times the p99 handler runtime.
         * Default: 5 minutes
         */
        public Builder withLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = positive(leaseDuration, "Lease duration");
            return this;
        }

        /**
         * Default: same as the lease duration
         */
        public Builder withExecutionTimeout(Duration timeout) {
            this.executionTimeout = timeout == null ? null : positive(timeout, "Execution timeout");
            return this;
        }

        /**
         * Attempts per scheduled occurrence, the first run included.
         * Default: 3
         */
        public Builder withMaxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Retry delay is {@code min(max, base * 2^attempt)}.
         * Default: 30 seconds and 15 minutes
         */
        public Builder withRetryBackoff(Duration base, Duration max) {
            this.retryBaseDelay = positive(base, "Retry base delay");
            this.retryMaxDelay = positive(max, "Retry max delay");
            return this;
        }

        /**
         * Disable a job after this many consecutive failures; 0 never disables.
         * Default: 0
         */
        public Builder withAutoDisableThreshold(int threshold) {
            if (threshold < 0) {
                throw new IllegalArgumentException("Auto-disable threshold must not be negative");
            }
            this.autoDisableThreshold = threshold;
            return this;
        }

        /**
         * Execution threads kept alive while idle.
         * Default: 4
         */
        public Builder withExecutionThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Execution threads must be at least 1");
            }
            this.executionThreads = threads;
            return this;
        }

        /**
         * Runs in flight at once. Every run gets its own thread up to this ceiling; a job
         * claimed beyond it is released and stays due. Never below the execution threads.
         * Default: 64
         */
        public Builder withMaxConcurrentRuns(int runs) {
            if (runs < 1) {
                throw new IllegalArgumentException("Max concurrent runs must be at least 1");
            }
            this.maxConcurrentRuns = runs;
            return this;
        }

        /**
         * Store reads retried within one trigger cycle.
         * Default: 3 attempts, 200ms initial backoff
         */
        public Builder withStoreRetry(int attempts, Duration backoff) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Store retry attempts must be at least 1");
            }
            this.storeRetryAttempts = attempts;
            this.storeRetryBackoff = backoff == null ? Duration.ZERO : backoff;
            return this;
        }

        /**
         * Cadence of the in-process tick loop.
         * Default: 60 seconds
         */
        public Builder withTickInterval(Duration interval) {
            this.tickInterval = positive(interval, "Tick interval");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
