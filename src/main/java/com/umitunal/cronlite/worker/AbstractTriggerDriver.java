package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.lease.Lease;
import com.umitunal.cronlite.lease.LeaseManager;
import com.umitunal.cronlite.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Claim-and-run logic shared by the trigger drivers.
 * <p>
 * Claims are made on the calling thread; each claimed run then gets its own thread from the
 * execution pool, so a slow handler only ever occupies the thread of its own run.
 */
public abstract class AbstractTriggerDriver implements TriggerDriver {
    private static final Logger log = LoggerFactory.getLogger(AbstractTriggerDriver.class);

    protected final JobStore store;
    protected final LeaseManager leaseManager;
    protected final ExecutionRunner runner;
    protected final ExecutorService executionPool;
    protected final StoreRetry storeRetry;
    protected final Clock clock;

    protected AbstractTriggerDriver(JobStore store, LeaseManager leaseManager, ExecutionRunner runner,
                                    ExecutorService executionPool, StoreRetry storeRetry, Clock clock) {
        this.store = store;
        this.leaseManager = leaseManager;
        this.runner = runner;
        this.executionPool = executionPool;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    @Override
    public TickSummary dispatchOnceCycle() {
        List<JobRecord> due = dueJobs();
        if (due.isEmpty()) {
            return TickSummary.empty();
        }
        List<Future<ExecutionRecord>> runs = claimAndDispatch(due);
        TickSummary summary = new TickSummary(due.size(), runs.size(), 0, 0);
        log.debug("Dispatched without waiting: {}", summary);
        return summary;
    }

    /**
     * Due jobs as of now, with store retries.
     */
    protected List<JobRecord> dueJobs() {
        Instant now = clock.instant();
        return storeRetry.call("listDue", () -> store.listDue(now));
    }

    /**
     * Claim one job.
     *
     * @return empty if the claim was lost or the store could not be reached
     */
    protected Optional<Lease> claim(JobRecord snapshot) {
        try {
            return storeRetry.call("claim", () -> leaseManager.claim(snapshot));
        } catch (StoreUnavailableException e) {
            // Still due; the next cycle claims it
            log.error("Could not claim job {}: {}", snapshot.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Hand a claimed run to the execution pool. When the pool is at its ceiling the lease is
     * given back so the job stays due for the next cycle.
     *
     * @return empty if the pool refused the run
     */
    protected Optional<Future<ExecutionRecord>> dispatch(JobRecord snapshot, Lease lease) {
        try {
            return Optional.of(executionPool.submit(() -> runner.execute(snapshot, lease)));
        } catch (RejectedExecutionException e) {
            log.warn("Execution pool full; releasing job {} for the next cycle", snapshot.getId());
            try {
                leaseManager.release(lease);
            } catch (StoreUnavailableException releaseFailure) {
                log.warn("Could not release job {}; its lease lapses at {}", snapshot.getId(), lease.getUntil());
            }
            return Optional.empty();
        }
    }

    /**
     * Claim every candidate, then start a run for each claim won.
     */
    protected List<Future<ExecutionRecord>> claimAndDispatch(List<JobRecord> candidates) {
        List<Future<ExecutionRecord>> runs = new ArrayList<>(candidates.size());
        for (JobRecord candidate : candidates) {
            Optional<Lease> lease = claim(candidate);
            if (lease.isPresent()) {
                dispatch(candidate, lease.get()).ifPresent(runs::add);
            }
        }
        return runs;
    }

    /**
     * Claim and start every candidate, then wait for all of the runs.
     */
    protected TickSummary runAll(List<JobRecord> candidates) {
        List<Future<ExecutionRecord>> runs = claimAndDispatch(candidates);

        int succeeded = 0;
        int failed = 0;
        for (Future<ExecutionRecord> run : runs) {
            try {
                if (run.get().isSuccess()) {
                    succeeded++;
                } else {
                    failed++;
                }
            } catch (ExecutionException e) {
                failed++;
                log.error("Run ended without a record", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} runs to finish", runs.size());
                break;
            }
        }

        return new TickSummary(candidates.size(), runs.size(), succeeded, failed);
    }
}
