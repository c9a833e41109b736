package com.umitunal.cronlite.worker;

/**
 * Decides when to look for due jobs.
 */
public interface TriggerDriver extends AutoCloseable {

    /**
     * Run every job that is due now and that this worker manages to claim.
     * Safe to call concurrently and repeatedly; overlapping cycles race for the same leases.
     *
     * @throws com.umitunal.cronlite.core.StoreUnavailableException if due jobs could not be listed
     */
    TickSummary runOnceCycle();

    /**
     * Claim every due job and start its run, without waiting for any run to finish. The
     * outcomes are not known yet, so the summary counts only checked and claimed jobs.
     *
     * @throws com.umitunal.cronlite.core.StoreUnavailableException if due jobs could not be listed
     */
    default TickSummary dispatchOnceCycle() {
        return runOnceCycle();
    }

    /**
     * Begin driving on its own. Drivers that are only ever invoked from outside do nothing.
     */
    default void start() {
    }

    @Override
    void close();
}
