package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.schedule.Schedule;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutable job record as held by a store. Instances handed out by a store are copies;
 * changing one has no effect until it goes back through a store operation.
 */
public class JobRecord implements Job {
    private String id;
    private String name;
    private boolean enabled;
    private Schedule schedule;
    private JobPayload payload;
    private Delivery delivery;
    private Instant createdAt;
    private Instant updatedAt;

    private Instant nextRunAt;
    private Instant lastRunAt;
    private RunStatus lastRunStatus;
    private String lastError;
    private int consecutiveFailures;
    private int currentAttempt;

    private String leaseHolder;
    private Instant leaseUntil;
    private long version;  // For optimistic locking

    public JobRecord() {
        this.enabled = true;
        this.lastRunStatus = RunStatus.NEVER;
    }

    public JobRecord(String id, Schedule schedule, JobPayload payload, Instant createdAt) {
        this();
        this.id = id;
        this.schedule = schedule;
        this.payload = payload;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    @Override
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    @Override
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Override
    public Schedule getSchedule() { return schedule; }
    public void setSchedule(Schedule schedule) { this.schedule = schedule; }

    @Override
    public JobPayload getPayload() { return payload; }
    public void setPayload(JobPayload payload) { this.payload = payload; }

    @Override
    public Delivery getDelivery() { return delivery; }
    public void setDelivery(Delivery delivery) { this.delivery = delivery; }

    @Override
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }

    @Override
    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    @Override
    public RunStatus getLastRunStatus() { return lastRunStatus; }
    public void setLastRunStatus(RunStatus lastRunStatus) {
        this.lastRunStatus = lastRunStatus == null ? RunStatus.NEVER : lastRunStatus;
    }

    @Override
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    @Override
    public int getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }

    @Override
    public int getCurrentAttempt() { return currentAttempt; }
    public void setCurrentAttempt(int currentAttempt) { this.currentAttempt = currentAttempt; }

    @Override
    public String getLeaseHolder() { return leaseHolder; }
    public void setLeaseHolder(String leaseHolder) { this.leaseHolder = leaseHolder; }

    @Override
    public Instant getLeaseUntil() { return leaseUntil; }
    public void setLeaseUntil(Instant leaseUntil) { this.leaseUntil = leaseUntil; }

    @Override
    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    /**
     * Enabled, scheduled, and {@code nextRunAt <= now}.
     */
    public boolean isDue(Instant now) {
        return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public boolean hasActiveLease(Instant now) {
        return leaseUntil != null && leaseUntil.isAfter(now);
    }

    /**
     * A lease can be taken when none is active, or renewed by its current holder.
     */
    public boolean isClaimableBy(String holder, Instant now) {
        return !hasActiveLease(now) || (leaseHolder != null && leaseHolder.equals(holder));
    }

    public boolean isHeldBy(String holder) {
        return leaseHolder != null && leaseHolder.equals(holder);
    }

    public void lease(String holder, Instant until) {
        this.leaseHolder = holder;
        this.leaseUntil = until;
    }

    public void clearLease() {
        this.leaseHolder = null;
        this.leaseUntil = null;
    }

    /**
     * Called by stores once per successful write.
     */
    public void incrementVersion() {
        this.version++;
    }

    public JobRecord copy() {
        JobRecord copy = new JobRecord();
        copy.id = id;
        copy.name = name;
        copy.enabled = enabled;
        copy.schedule = schedule;
        copy.payload = payload;
        copy.delivery = delivery;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.nextRunAt = nextRunAt;
        copy.lastRunAt = lastRunAt;
        copy.lastRunStatus = lastRunStatus;
        copy.lastError = lastError;
        copy.consecutiveFailures = consecutiveFailures;
        copy.currentAttempt = currentAttempt;
        copy.leaseHolder = leaseHolder;
        copy.leaseUntil = leaseUntil;
        copy.version = version;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', name='%s', enabled=%s, schedule=%s, kind=%s, next=%s, status=%s, failures=%d, holder='%s', version=%d}",
                id, name, enabled, schedule, payload == null ? null : payload.getKind(), nextRunAt,
                lastRunStatus, consecutiveFailures, leaseHolder, version);
    }
}
