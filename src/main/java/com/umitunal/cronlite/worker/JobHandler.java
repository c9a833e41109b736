package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.JobResult;

/**
 * Executes the payload of one payload kind.
 * <p>
 * Long-running handlers should poll {@link ExecutionContext#isCancelled()} and call
 * {@link ExecutionContext#renewLease()} periodically; once the lease is lost another
 * worker may already be running the same job.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job once.
     *
     * @param context the job, its attempt number and the lease controls
     * @return the outcome; a failed result is retried like a thrown exception
     * @throws Exception if the run fails
     */
    JobResult handle(ExecutionContext context) throws Exception;
}
