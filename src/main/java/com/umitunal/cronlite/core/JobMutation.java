package com.umitunal.cronlite.core;

import com.umitunal.cronlite.model.JobRecord;

/**
 * A change applied to a job inside the store's atomic read-check-write step.
 */
@FunctionalInterface
public interface JobMutation {

    void apply(JobRecord job);
}
