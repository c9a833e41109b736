package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One attempt of one job. Written once, never modified.
 */
public final class ExecutionRecord {
    private static final int MAX_ERROR_LENGTH = 1900;

    private String jobId;
    private int attemptNumber;
    private Instant startedAt;
    private Duration duration;
    private Outcome outcome;
    private String errorSummary;
    private String holder;

    // Kryo
    private ExecutionRecord() {
    }

    @JsonCreator
    public ExecutionRecord(@JsonProperty("jobId") String jobId,
                           @JsonProperty("attemptNumber") int attemptNumber,
                           @JsonProperty("startedAt") Instant startedAt,
                           @JsonProperty("duration") Duration duration,
                           @JsonProperty("outcome") Outcome outcome,
                           @JsonProperty("errorSummary") String errorSummary,
                           @JsonProperty("holder") String holder) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.attemptNumber = attemptNumber;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.duration = duration == null ? Duration.ZERO : duration;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.errorSummary = trimError(errorSummary);
        this.holder = holder;
    }

    public String getJobId() { return jobId; }
    public int getAttemptNumber() { return attemptNumber; }
    public Instant getStartedAt() { return startedAt; }
    public Duration getDuration() { return duration; }
    public Outcome getOutcome() { return outcome; }
    public String getErrorSummary() { return errorSummary; }
    public String getHolder() { return holder; }

    @JsonIgnore
    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /**
     * Collapses whitespace and caps the length so one noisy stack trace cannot bloat the history.
     */
    static String trimError(String error) {
        if (error == null) return null;
        String trimmed = error.replaceAll("\\s+", " ").trim();
        return trimmed.length() > MAX_ERROR_LENGTH ? trimmed.substring(0, MAX_ERROR_LENGTH) : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionRecord)) return false;
        ExecutionRecord that = (ExecutionRecord) o;
        return attemptNumber == that.attemptNumber
                && jobId.equals(that.jobId)
                && startedAt.equals(that.startedAt)
                && duration.equals(that.duration)
                && outcome == that.outcome
                && Objects.equals(errorSummary, that.errorSummary)
                && Objects.equals(holder, that.holder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, attemptNumber, startedAt, duration, outcome, errorSummary, holder);
    }

    @Override
    public String toString() {
        return String.format("ExecutionRecord{job='%s', attempt=%d, started=%s, duration=%dms, outcome=%s, error='%s'}",
                jobId, attemptNumber, startedAt, duration.toMillis(), outcome, errorSummary);
    }

    public enum Outcome {
        SUCCESS,
        FAILURE,
        TIMEOUT
    }
}
