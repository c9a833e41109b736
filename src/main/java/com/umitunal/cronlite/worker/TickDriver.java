package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.lease.LeaseManager;
import com.umitunal.cronlite.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Stateless driver for serverless deployments: an external timer calls
 * {@link #runOnceCycle()} and every call finishes all the work it claimed before returning.
 * Runs of one cycle execute in parallel, each on its own thread; an in-process
 * {@link TickLoop} uses {@link #dispatchOnceCycle()} instead so that it never waits for them.
 * <p>
 * The tick cadence bounds the finest schedule granularity: a job due between two ticks runs
 * at the second one.
 */
public class TickDriver extends AbstractTriggerDriver {
    private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

    public TickDriver(JobStore store, LeaseManager leaseManager, ExecutionRunner runner,
                      ExecutorService executionPool, StoreRetry storeRetry, Clock clock) {
        super(store, leaseManager, runner, executionPool, storeRetry, clock);
    }

    @Override
    public TickSummary runOnceCycle() {
        List<JobRecord> due = dueJobs();
        if (due.isEmpty()) {
            log.debug("Tick: nothing due");
            return TickSummary.empty();
        }

        TickSummary summary = runAll(due);
        log.info("Tick finished: {}", summary);
        return summary;
    }

    @Override
    public void close() {
        // Owns no threads; the execution pool belongs to the caller
    }
}
