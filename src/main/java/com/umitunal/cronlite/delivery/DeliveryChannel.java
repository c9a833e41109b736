package com.umitunal.cronlite.delivery;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobResult;

/**
 * Transport for announcing job results.
 */
@FunctionalInterface
public interface DeliveryChannel {

    /**
     * @param target channel-specific destination from the job's delivery settings
     * @throws Exception if the announcement could not be delivered
     */
    void deliver(String target, Job job, JobResult result) throws Exception;
}
