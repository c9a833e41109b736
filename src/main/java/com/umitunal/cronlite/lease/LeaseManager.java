package com.umitunal.cronlite.lease;

import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Acquires, renews and releases execution leases through the store's conditional writes.
 * <p>
 * Every claim gets its own holder id ({@code <workerId>/<uuid>}), so two runs started by the
 * same process are as exclusive as runs on different machines. Expired leases need no sweeper:
 * the next claim after {@code leaseUntil} simply wins.
 */
public class LeaseManager {
    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);

    private final JobStore store;
    private final String workerId;
    private final Duration leaseDuration;
    private final Clock clock;

    public LeaseManager(JobStore store, String workerId, Duration leaseDuration, Clock clock) {
        this.store = store;
        this.workerId = workerId;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    /**
     * Try to lease the job as seen in {@code snapshot}.
     *
     * @return empty if another holder got there first, the job changed since the snapshot,
     * or the job was deleted
     */
    public Optional<Lease> claim(JobRecord snapshot) {
        String holder = workerId + "/" + UUID.randomUUID();
        Instant now = clock.instant();

        boolean claimed;
        try {
            claimed = store.tryClaim(snapshot.getId(), holder, leaseDuration, snapshot.getVersion(), now);
        } catch (JobNotFoundException e) {
            log.debug("Job {} was deleted before it could be claimed", snapshot.getId());
            return Optional.empty();
        }

        if (!claimed) {
            log.debug("Lost claim race for job {} (version {})", snapshot.getId(), snapshot.getVersion());
            return Optional.empty();
        }

        log.info("Claimed job {} as {} until {}", snapshot.getId(), holder, now.plus(leaseDuration));
        return Optional.of(new Lease(snapshot.getId(), holder, now, now.plus(leaseDuration)));
    }

    /**
     * Push the lease out to {@code now + leaseDuration}.
     *
     * @return false if the lease was taken over; the run must stop
     */
    public boolean renew(Lease lease) {
        Instant now = clock.instant();
        boolean renewed = store.renewLease(lease.getJobId(), lease.getHolder(), leaseDuration, now);
        if (renewed) {
            lease.extendTo(now.plus(leaseDuration));
        } else {
            log.warn("Lease on job {} held by {} was lost", lease.getJobId(), lease.getHolder());
        }
        return renewed;
    }

    /**
     * Give the lease back without recording a run. No-op if it is no longer ours.
     */
    public boolean release(Lease lease) {
        return store.releaseLease(lease.getJobId(), lease.getHolder());
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public String getWorkerId() {
        return workerId;
    }
}
